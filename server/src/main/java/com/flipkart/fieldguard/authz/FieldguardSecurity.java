package com.flipkart.fieldguard.authz;

import com.flipkart.fieldguard.spi.PermissionBackend;
import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import com.flipkart.fieldguard.spi.authz.Principal;
import com.flipkart.fieldguard.spimpl.authn.SimpleFieldguardUser;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * A security facade bean that turns the Spring Security authentication of a request into the
 * {@link Principal} used for field authorization.
 * <p>
 * The principal is built once per request and then passed explicitly to every field interception, so nothing
 * downstream reads the security context again. Requests without an authenticated {@link FieldguardUser}
 * get the anonymous principal.
 */
@Component
@RequiredArgsConstructor
public class FieldguardSecurity {

    private final List<PermissionBackend> permissionBackends;

    /**
     * Builds the principal for the authentication bound to the current thread.
     */
    public Principal currentPrincipal() {
        return principalFor(SecurityContextHolder.getContext().getAuthentication());
    }

    public Principal principalFor(Authentication authentication) {
        FieldguardUser user = Optional.ofNullable(authentication)
                .filter(Authentication::isAuthenticated)
                .map(Authentication::getPrincipal)
                .filter(FieldguardUser.class::isInstance)
                .map(FieldguardUser.class::cast)
                .orElse(SimpleFieldguardUser.ANONYMOUS);
        return principalFor(user);
    }

    public Principal principalFor(FieldguardUser user) {
        return new Principal(user.getName(), PermissionOracles.anyOf(user, permissionBackends));
    }

    public Principal anonymousPrincipal() {
        return principalFor(SimpleFieldguardUser.ANONYMOUS);
    }
}
