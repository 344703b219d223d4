package com.flipkart.fieldguard.repositories;

import com.flipkart.fieldguard.models.resolved.LazySequence;
import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.GuardedEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Keeps entities in insertion order. Queries return {@link LazySequence}s which read the store only when
 * iterated, and every such read is counted.
 */
public abstract class InMemoryRepository<T extends GuardedEntity> {

    private final Map<String, T> store = new LinkedHashMap<>();
    private final AtomicInteger queryCount = new AtomicInteger();
    private final EntityKind kind;

    protected InMemoryRepository(EntityKind kind) {
        this.kind = kind;
    }

    protected abstract String idOf(T entity);

    protected abstract void assignId(T entity, String id);

    public synchronized T save(T entity) {
        if (idOf(entity) == null) {
            assignId(entity, UUID.randomUUID().toString());
        }
        store.put(idOf(entity), entity);
        return entity;
    }

    public synchronized Optional<T> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    public LazySequence<T> findAll() {
        return query(entity -> true);
    }

    public synchronized void deleteAll() {
        store.clear();
        queryCount.set(0);
    }

    /**
     * @return how many query results have been fetched so far
     */
    public int getQueryCount() {
        return queryCount.get();
    }

    protected LazySequence<T> query(Predicate<? super T> filter) {
        return LazySequence.of(kind, () -> {
            queryCount.incrementAndGet();
            return snapshot().stream().filter(filter);
        });
    }

    private synchronized List<T> snapshot() {
        return new ArrayList<>(store.values());
    }
}
