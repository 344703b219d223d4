package com.flipkart.fieldguard.exception;

import com.flipkart.fieldguard.models.exception.PermissionDeniedException;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.execution.ResultPath;
import graphql.schema.DataFetchingEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Reports a {@link PermissionDeniedException} as a {@code FORBIDDEN} error at the denied field's path, so the rest
 * of the response is still returned. Ordered before Spring's security resolver, which would report anonymous
 * callers as unauthorized instead.
 * <p>
 * A {@link ResponseStatusException} with status 404 becomes a {@code NOT_FOUND} error.
 * Other exceptions, including failures of permission backends, are logged and left to the default handling.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class FieldguardExceptionResolver extends DataFetcherExceptionResolverAdapter {

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        if (ex instanceof PermissionDeniedException denied) {
            return forbidden(denied, env);
        }
        if (ex instanceof ResponseStatusException statusException && HttpStatus.NOT_FOUND.equals(statusException.getStatusCode())) {
            return GraphqlErrorBuilder.newError(env)
                    .errorType(ErrorType.NOT_FOUND)
                    .message(statusException.getReason())
                    .build();
        }
        log.error("Exception occurred while fetching {}", env.getExecutionStepInfo().getPath(), ex);
        return null;
    }

    /**
     * The error reported for a denied field, also used where a denial has to be returned as data fetcher result.
     */
    public static GraphQLError forbidden(PermissionDeniedException denied, DataFetchingEnvironment env) {
        return GraphqlErrorBuilder.newError(env)
                .errorType(ErrorType.FORBIDDEN)
                .message(denied.getMessage())
                .path(ResultPath.fromList(denied.getPath()))
                .build();
    }
}
