package com.flipkart.fieldguard.spi.authz;

import com.flipkart.fieldguard.spi.models.GuardedEntity;

import java.util.Objects;

/**
 * The requesting identity of one GraphQL request. Immutable and shared read-only by every field of the request.
 */
public final class Principal {

    private final String name;
    private final PermissionOracle oracle;

    public Principal(String name, PermissionOracle oracle) {
        this.name = Objects.requireNonNull(name, "name");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    public String getName() {
        return name;
    }

    public boolean hasModelPermission(String permission) {
        return oracle.hasModelPermission(permission);
    }

    public boolean hasInstancePermission(String permission, GuardedEntity entity) {
        return oracle.hasInstancePermission(permission, entity);
    }

    @Override
    public String toString() {
        return "Principal[" + name + "]";
    }
}
