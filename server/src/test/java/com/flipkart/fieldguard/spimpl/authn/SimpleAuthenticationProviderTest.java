package com.flipkart.fieldguard.spimpl.authn;

import com.flipkart.fieldguard.spi.authn.FieldguardUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SimpleAuthenticationProviderTest {

    private final AuthenticationManager authenticationManager = mock();

    private final SimpleAuthenticationProvider authenticationProvider = new SimpleAuthenticationProvider();

    @BeforeEach
    void setUp() {
        authenticationProvider.initialize(authenticationManager);
    }

    @Test
    void authenticate_WithValidBasicAuth_ReturnsFieldguardUser() {
        // Given
        MockHttpServletRequest request = basicAuthRequest("testuser", "testpass");
        Authentication mockAuth = new UsernamePasswordAuthenticationToken("testuser", "testpass",
                AuthorityUtils.createAuthorityList("ROLE_USER"));
        when(authenticationManager.authenticate(any(Authentication.class))).thenReturn(mockAuth);

        // When
        FieldguardUser result = authenticationProvider.authenticate(request);

        // Then
        assertNotNull(result);
        assertEquals("testuser", result.getName());
        assertFalse(result.isSuperuser());
        assertFalse(result.isAnonymous());
        verify(authenticationManager).authenticate(any(Authentication.class));
    }

    @Test
    void authenticate_WithSuperuserRole_ReturnsSuperuser() {
        // Given
        MockHttpServletRequest request = basicAuthRequest("admin", "adminpass");
        Authentication mockAuth = new UsernamePasswordAuthenticationToken("admin", "adminpass",
                AuthorityUtils.createAuthorityList("ROLE_USER", SimpleAuthenticationProvider.SUPERUSER_ROLE));
        when(authenticationManager.authenticate(any(Authentication.class))).thenReturn(mockAuth);

        // When
        FieldguardUser result = authenticationProvider.authenticate(request);

        // Then
        assertEquals("admin", result.getName());
        assertTrue(result.isSuperuser());
    }

    @Test
    void authenticate_WithNoAuthorizationHeader_ReturnsNull() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest();

        // When
        FieldguardUser result = authenticationProvider.authenticate(request);

        // Then
        assertNull(result);
        verify(authenticationManager, never()).authenticate(any(Authentication.class));
    }

    @Test
    void authenticate_WithBadCredentials_Throws() {
        // Given
        MockHttpServletRequest request = basicAuthRequest("testuser", "wrong");
        when(authenticationManager.authenticate(any(Authentication.class))).thenThrow(new BadCredentialsException("Bad credentials"));

        // When & Then
        assertThrows(BadCredentialsException.class, () -> authenticationProvider.authenticate(request));
    }

    private static MockHttpServletRequest basicAuthRequest(String username, String password) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        String credentials = Base64.getEncoder().encodeToString((username + ":" + password).getBytes());
        request.addHeader("Authorization", "Basic " + credentials);
        return request;
    }
}
