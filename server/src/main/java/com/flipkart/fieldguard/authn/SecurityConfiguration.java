package com.flipkart.fieldguard.authn;

import com.flipkart.fieldguard.configuration.properties.AuthenticationProperties;
import com.flipkart.fieldguard.spi.FieldguardAuthenticationProvider;
import com.flipkart.fieldguard.spimpl.authn.SimpleAuthenticationProvider;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.authentication.configuration.AuthenticationConfiguration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.context.SecurityContextHolderFilter;

import java.util.List;

/**
 * GraphQL is open to anonymous callers: authentication only decides which principal the response is authorized for.
 */
@Configuration
public class SecurityConfiguration {

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, FieldguardAuthenticationProvider authenticationProvider,
                                           AuthenticationConfiguration authenticationConfiguration) throws Exception {
        authenticationProvider.initialize(authenticationConfiguration.getAuthenticationManager());

        http
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(authz -> authz
                        .requestMatchers("/graphql", "/graphiql", "/error", "/actuator/**").permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((request, response, e) -> response.sendError(HttpServletResponse.SC_UNAUTHORIZED, e.getMessage()))
                )
                .csrf(AbstractHttpConfigurer::disable);

        // runs ahead of authorization; failed credentials end the request with a 401
        http.addFilterAfter(new AuthenticationFilter(authenticationProvider), SecurityContextHolderFilter.class);

        return http.build();
    }

    @Bean
    @ConditionalOnMissingBean(FieldguardAuthenticationProvider.class)
    public FieldguardAuthenticationProvider fieldguardAuthenticationProvider() {
        return new SimpleAuthenticationProvider();
    }

    @Bean
    public UserDetailsService userDetailsService(AuthenticationProperties authenticationProperties) {
        List<UserDetails> users = authenticationProperties.getUsers().stream()
                .map(user -> User.withUsername(user.getName())
                        .password(user.getPassword())
                        .roles(user.isSuperuser() ? new String[]{"USER", "SUPERUSER"} : new String[]{"USER"})
                        .build())
                .toList();
        return new InMemoryUserDetailsManager(users);
    }
}
