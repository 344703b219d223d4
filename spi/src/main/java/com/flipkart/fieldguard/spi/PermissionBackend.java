package com.flipkart.fieldguard.spi;

import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import com.flipkart.fieldguard.spi.models.GuardedEntity;

/**
 * Interface for a permission backend in the Fieldguard authorization chain.
 * A backend answers whether a user holds a permission, either for every instance of an entity kind
 * or for one specific instance. Backends are consulted in order and a permission is granted as soon as
 * any of them grants it, so an implementation only needs to know about the grants it owns.
 * <p>
 * Implementations must be read-only and side effect free. They are called once per relevant entity per
 * field, so they should be cheap enough to call for every member of a typical result page.
 */
public interface PermissionBackend {

    /**
     * Checks if the user holds the permission for all instances, e.g. through an explicit or group grant.
     *
     * @param user       the requesting user
     * @param permission the permission name, e.g. {@code tracker.view_project}
     * @return true if the permission is granted by this backend
     */
    boolean hasModelPermission(FieldguardUser user, String permission);

    /**
     * Checks if the user holds the permission scoped to one entity instance.
     * Backends without instance-scoped logic keep this default, which falls back to the model level check
     * so that model level access never turns into a denial for an instance.
     *
     * @param user       the requesting user
     * @param permission the permission name
     * @param entity     the instance being checked
     * @return true if the permission is granted by this backend for the given instance
     */
    default boolean hasInstancePermission(FieldguardUser user, String permission, GuardedEntity entity) {
        return hasModelPermission(user, permission);
    }
}
