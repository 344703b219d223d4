package com.flipkart.fieldguard.spi.authz;

import com.flipkart.fieldguard.spi.models.EntityKind;

/**
 * Builds permission names of the form {@code <namespace>.<action>_<kind>}, e.g. {@code tracker.view_project}.
 */
public final class PermissionNames {

    public static final String VIEW = "view";

    private PermissionNames() {
    }

    public static String permissionName(EntityKind kind, String action) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action must not be blank");
        }
        return kind.namespace() + "." + action + "_" + kind.name();
    }

    public static String viewPermission(EntityKind kind) {
        return permissionName(kind, VIEW);
    }
}
