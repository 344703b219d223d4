package com.flipkart.fieldguard.authz;

import com.flipkart.fieldguard.spi.PermissionBackend;
import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import com.flipkart.fieldguard.spi.authz.PermissionOracle;
import com.flipkart.fieldguard.spi.models.GuardedEntity;

import java.util.List;

/**
 * Combines permission backends into the oracle of one user.
 */
public final class PermissionOracles {

    private PermissionOracles() {
    }

    /**
     * A superuser holds every permission. Anyone else holds a permission if any backend grants it,
     * backends being asked in the given order.
     */
    public static PermissionOracle anyOf(FieldguardUser user, List<? extends PermissionBackend> backends) {
        return new ChainedOracle(user, List.copyOf(backends));
    }

    private record ChainedOracle(FieldguardUser user, List<PermissionBackend> backends) implements PermissionOracle {

        @Override
        public boolean hasModelPermission(String permission) {
            if (user.isSuperuser()) {
                return true;
            }
            for (PermissionBackend backend : backends) {
                if (backend.hasModelPermission(user, permission)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean hasInstancePermission(String permission, GuardedEntity entity) {
            if (user.isSuperuser()) {
                return true;
            }
            for (PermissionBackend backend : backends) {
                if (backend.hasInstancePermission(user, permission, entity)) {
                    return true;
                }
            }
            return false;
        }
    }
}
