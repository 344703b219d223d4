package com.flipkart.fieldguard.spimpl.authz;

import com.flipkart.fieldguard.configuration.properties.AuthorizationProperties;
import com.flipkart.fieldguard.spi.PermissionBackend;
import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * A simple implementation of the {@link PermissionBackend} that uses a static set of rules
 * defined in the application's configuration file via {@link AuthorizationProperties}.
 * Every rule grants model level permissions, it has no notion of instances, so instance checks fall back to the
 * model level check. Supports wildcard matching for users and permissions. Anonymous users match no rule.
 */
@Component
@Order(0)
@RequiredArgsConstructor
public class ConfiguredPermissionBackend implements PermissionBackend {

    private final AuthorizationProperties authorizationProperties;

    @Override
    public boolean hasModelPermission(FieldguardUser user, String permission) {
        List<AuthorizationProperties.Rule> rules = authorizationProperties.getRules();
        if (user.isAnonymous() || rules == null) {
            return false;
        }
        return rules.stream()
                .filter(rule -> userMatches(rule, user.getName()))
                .anyMatch(rule -> permissionMatches(rule, permission));
    }

    private boolean userMatches(AuthorizationProperties.Rule rule, String username) {
        return "*".equals(rule.getUser()) || rule.getUser().equals(username);
    }

    private boolean permissionMatches(AuthorizationProperties.Rule rule, String permission) {
        return Optional.ofNullable(rule.getPermissions())
                .map(permissions -> permissions.contains("*") || permissions.contains(permission))
                .orElse(false);
    }
}
