package com.flipkart.fieldguard.spi.authn;

import org.springframework.security.core.AuthenticatedPrincipal;

/**
 * The user on whose behalf a GraphQL request is executed.
 */
public interface FieldguardUser extends AuthenticatedPrincipal {

    @Override
    String getName();

    /**
     * A superuser implicitly holds every permission, without consulting any backend.
     */
    boolean isSuperuser();

    /**
     * Anonymous users are never granted anything by the configured rules.
     */
    default boolean isAnonymous() {
        return false;
    }
}
