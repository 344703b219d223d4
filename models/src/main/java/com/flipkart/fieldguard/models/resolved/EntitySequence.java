package com.flipkart.fieldguard.models.resolved;

import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.GuardedEntity;

import java.util.List;

/**
 * An ordered group of entities sharing one {@link EntityKind}.
 * <p>
 * A {@link LazySequence} runs its fetch when first iterated and can only be iterated once, while a
 * {@link MaterializedSequence} is already in memory. Authorization treats both the same way and iterates
 * each at most once, so filtering never costs a second fetch.
 *
 * @param <T> the entity type
 */
public sealed interface EntitySequence<T extends GuardedEntity> extends Iterable<T>
        permits LazySequence, MaterializedSequence {

    EntityKind kind();

    static <T extends GuardedEntity> MaterializedSequence<T> of(EntityKind kind, List<T> members) {
        return new MaterializedSequence<>(kind, List.copyOf(members));
    }
}
