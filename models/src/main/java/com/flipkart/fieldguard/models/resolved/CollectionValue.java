package com.flipkart.fieldguard.models.resolved;

import com.flipkart.fieldguard.spi.models.EntityKind;

import java.util.Objects;

/**
 * Entities of a single kind. The members are not touched until the collection is filtered or rendered.
 */
public record CollectionValue(EntitySequence<?> members) implements ResolvedValue {

    public CollectionValue {
        Objects.requireNonNull(members, "members");
    }

    public EntityKind kind() {
        return members.kind();
    }

    @Override
    public Object raw() {
        return members;
    }
}
