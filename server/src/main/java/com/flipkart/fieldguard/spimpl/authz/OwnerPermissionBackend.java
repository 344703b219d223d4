package com.flipkart.fieldguard.spimpl.authz;

import com.flipkart.fieldguard.configuration.properties.AuthorizationProperties;
import com.flipkart.fieldguard.spi.PermissionBackend;
import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import com.flipkart.fieldguard.spi.models.GuardedEntity;
import com.flipkart.fieldguard.spi.models.OwnedEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Grants the permissions listed in {@code authorization.owner-permissions} on the instances a user owns.
 * Never grants anything at model level.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class OwnerPermissionBackend implements PermissionBackend {

    private final AuthorizationProperties authorizationProperties;

    @Override
    public boolean hasModelPermission(FieldguardUser user, String permission) {
        return false;
    }

    @Override
    public boolean hasInstancePermission(FieldguardUser user, String permission, GuardedEntity entity) {
        if (user.isAnonymous() || !(entity instanceof OwnedEntity owned)) {
            return false;
        }
        return authorizationProperties.getOwnerPermissions().contains(permission)
                && user.getName().equals(owned.getOwnerName());
    }
}
