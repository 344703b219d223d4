package com.flipkart.fieldguard.spimpl.authn;

import com.flipkart.fieldguard.spi.FieldguardAuthenticationProvider;
import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.web.authentication.AuthenticationConverter;
import org.springframework.security.web.authentication.www.BasicAuthenticationConverter;

/**
 * A simple implementation of the AuthenticationProvider interface that uses Basic Authentication.
 * The actual authentication is done by the AuthenticationManager so that spring's UserDetailsService can be used for authentication.
 * Users holding the {@value #SUPERUSER_ROLE} authority become superusers.
 */
public class SimpleAuthenticationProvider implements FieldguardAuthenticationProvider {

    public static final String SUPERUSER_ROLE = "ROLE_SUPERUSER";

    private final AuthenticationConverter authenticationConverter = new BasicAuthenticationConverter();
    private AuthenticationManager authenticationManager;

    @Override
    public void initialize(AuthenticationManager authenticationManager) {
        this.authenticationManager = authenticationManager;
    }

    @Override
    public FieldguardUser authenticate(HttpServletRequest request) {
        Authentication authRequest = authenticationConverter.convert(request);
        if (authRequest == null) {
            return null;
        }
        Authentication authenticate = authenticationManager.authenticate(authRequest);
        boolean superuser = AuthorityUtils.authorityListToSet(authenticate.getAuthorities()).contains(SUPERUSER_ROLE);
        return new SimpleFieldguardUser(authenticate.getName(), superuser);
    }
}
