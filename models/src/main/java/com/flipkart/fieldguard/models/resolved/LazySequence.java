package com.flipkart.fieldguard.models.resolved;

import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.GuardedEntity;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * A query result that has not been fetched yet. The fetch runs when the sequence is first iterated;
 * a second iteration is rejected instead of silently fetching again.
 *
 * @param <T> the entity type
 */
public final class LazySequence<T extends GuardedEntity> implements EntitySequence<T> {

    private final EntityKind kind;
    private final Supplier<? extends Stream<? extends T>> fetch;
    private final AtomicBoolean consumed = new AtomicBoolean();

    private LazySequence(EntityKind kind, Supplier<? extends Stream<? extends T>> fetch) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.fetch = Objects.requireNonNull(fetch, "fetch");
    }

    public static <T extends GuardedEntity> LazySequence<T> of(EntityKind kind, Supplier<? extends Stream<? extends T>> fetch) {
        return new LazySequence<>(kind, fetch);
    }

    @Override
    public EntityKind kind() {
        return kind;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    @Override
    public Iterator<T> iterator() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Lazy sequence of " + kind + " was already consumed");
        }
        Stream<T> stream = fetch.get().map(entity -> (T) entity);
        return stream.iterator();
    }

    @Override
    public String toString() {
        return "LazySequence[" + kind + (consumed.get() ? ", consumed]" : "]");
    }
}
