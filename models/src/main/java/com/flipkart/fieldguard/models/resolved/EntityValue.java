package com.flipkart.fieldguard.models.resolved;

import com.flipkart.fieldguard.spi.models.GuardedEntity;

import java.util.Objects;

public record EntityValue(GuardedEntity entity) implements ResolvedValue {

    public EntityValue {
        Objects.requireNonNull(entity, "entity");
    }

    @Override
    public Object raw() {
        return entity;
    }
}
