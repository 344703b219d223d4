package com.flipkart.fieldguard.graphql;

import com.flipkart.fieldguard.authz.FieldguardSecurity;
import com.flipkart.fieldguard.spi.authz.Principal;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Resolves the principal of a GraphQL HTTP request once and stores it in the {@code GraphQLContext},
 * where {@link FieldAuthorizationInstrumentation} picks it up for every field.
 */
@Component
@RequiredArgsConstructor
public class PrincipalGraphQlInterceptor implements WebGraphQlInterceptor {

    private final FieldguardSecurity fieldguardSecurity;

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        Principal principal = fieldguardSecurity.currentPrincipal();
        request.configureExecutionInput((executionInput, builder) ->
                builder.graphQLContext(context -> context.put(Principal.class, principal)).build());
        return chain.next(request);
    }
}
