package com.flipkart.fieldguard.spi;

import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AuthenticationManager;

/**
 * Interface for an authentication provider in the Fieldguard security framework.
 * If there are multiple authentication providers, Fieldguard will pick the bean with {@code @Primary} annotation
 */
public interface FieldguardAuthenticationProvider {

    default void initialize(AuthenticationManager authenticationManager) {
        // no-op; override if you need the manager
    }

    /**
     * Authenticate the request.
     * If returned object is null, the request continues as anonymous and only sees data that needs no permission.
     * If an AuthenticationException is thrown, the request will be rejected right away.
     */
    FieldguardUser authenticate(HttpServletRequest request);
}
