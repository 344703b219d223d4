package com.flipkart.fieldguard.spi.authz;

import com.flipkart.fieldguard.spi.models.GuardedEntity;

/**
 * Answers permission questions for one principal. Both operations are read-only.
 */
public interface PermissionOracle {

    boolean hasModelPermission(String permission);

    /**
     * Instance-scoped check. Must return true whenever {@link #hasModelPermission(String)} does.
     */
    boolean hasInstancePermission(String permission, GuardedEntity entity);
}
