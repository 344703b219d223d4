package com.flipkart.fieldguard.graphql;

import com.flipkart.fieldguard.authz.FieldAuthorizationInterceptor;
import com.flipkart.fieldguard.authz.ResolvedValueClassifier;
import com.flipkart.fieldguard.exception.FieldguardExceptionResolver;
import com.flipkart.fieldguard.models.exception.PermissionDeniedException;
import com.flipkart.fieldguard.models.resolved.AuthorizedOutcome;
import com.flipkart.fieldguard.models.resolved.FieldContext;
import com.flipkart.fieldguard.models.resolved.MixedSequenceValue;
import com.flipkart.fieldguard.spi.authz.Principal;
import graphql.execution.DataFetcherResult;
import graphql.execution.instrumentation.InstrumentationState;
import graphql.execution.instrumentation.SimplePerformantInstrumentation;
import graphql.execution.instrumentation.parameters.InstrumentationFieldFetchParameters;
import graphql.relay.Connection;
import graphql.relay.ConnectionCursor;
import graphql.relay.DefaultConnection;
import graphql.relay.DefaultPageInfo;
import graphql.relay.Edge;
import graphql.relay.PageInfo;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;
import graphql.schema.GraphQLTypeUtil;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Hooks the {@link FieldAuthorizationInterceptor} into graphql-java. Every data fetcher, including the default
 * property fetchers of nested fields, is wrapped so that its value is authorized before the engine completes the
 * field or resolves children from it.
 * <p>
 * The principal is read from the request's {@code GraphQLContext} under the {@link Principal} class key. Requests
 * that carry none are authorized as {@code fallbackPrincipal}.
 * <p>
 * A relay {@link Connection} is authorized through its nodes, like any other list: edges whose node may not be
 * viewed are dropped and the page info is narrowed to the remaining edges. The connection is never denied.
 * <p>
 * When a resolver returns a {@link DataFetcherResult} whose data is denied, the denial is reported next to the
 * errors the resolver already attached.
 * <p>
 * Every denied or redacted entity increments the {@value #DENIAL_METRIC} counter, tagged with its outcome.
 */
@Slf4j
@RequiredArgsConstructor
public class FieldAuthorizationInstrumentation extends SimplePerformantInstrumentation {

    public static final String DENIAL_METRIC = "field-authorization-denial";
    public static final String OUTCOME_TAG = "outcome";

    private final FieldAuthorizationInterceptor interceptor;
    private final ResolvedValueClassifier classifier;
    private final Principal fallbackPrincipal;
    private final MeterRegistry meterRegistry;

    @Override
    public DataFetcher<?> instrumentDataFetcher(DataFetcher<?> dataFetcher, InstrumentationFieldFetchParameters parameters,
                                                InstrumentationState state) {
        return environment -> authorize(dataFetcher.get(environment), environment);
    }

    private Object authorize(Object fetched, DataFetchingEnvironment environment) {
        if (fetched instanceof CompletionStage<?> stage) {
            return stage.thenApply(value -> authorize(value, environment));
        }
        if (fetched instanceof DataFetcherResult<?> result) {
            DataFetcherResult.Builder<Object> authorized = DataFetcherResult.newResult()
                    .errors(result.getErrors())
                    .localContext(result.getLocalContext());
            try {
                authorized.data(authorizeValue(result.getData(), environment));
            } catch (PermissionDeniedException e) {
                authorized.error(FieldguardExceptionResolver.forbidden(e, environment));
            }
            return authorized.build();
        }
        return authorizeValue(fetched, environment);
    }

    private Object authorizeValue(Object value, DataFetchingEnvironment environment) {
        if (value instanceof Optional<?> optional) {
            value = optional.orElse(null);
        }
        FieldContext field = new FieldContext(GraphQLTypeUtil.isNonNull(environment.getFieldType()),
                environment.getExecutionStepInfo().getPath().toList());
        if (value instanceof Connection<?> connection) {
            return authorizeConnection(principalOf(environment), connection, field);
        }
        AuthorizedOutcome outcome = interceptor.intercept(principalOf(environment), classifier.classify(value), field);
        if (outcome instanceof AuthorizedOutcome.Denied) {
            meterRegistry.counter(DENIAL_METRIC, OUTCOME_TAG, "error").increment();
        } else if (outcome instanceof AuthorizedOutcome.Redacted) {
            meterRegistry.counter(DENIAL_METRIC, OUTCOME_TAG, "null").increment();
        }
        return outcome.unwrap();
    }

    private Connection<?> authorizeConnection(Principal principal, Connection<?> connection, FieldContext field) {
        List<Object> nodes = new ArrayList<>();
        for (Edge<?> edge : connection.getEdges()) {
            nodes.add(edge.getNode());
        }
        List<?> retained = (List<?>) interceptor.intercept(principal, new MixedSequenceValue(nodes), field).unwrap();
        if (retained.size() == nodes.size()) {
            return connection;
        }
        return retainEdges(connection, retained);
    }

    /**
     * Keeps the edges whose node is in {@code retainedNodes}, which must be an ordered subsequence of the nodes.
     */
    private static <T> Connection<T> retainEdges(Connection<T> connection, List<?> retainedNodes) {
        List<Edge<T>> edges = new ArrayList<>(retainedNodes.size());
        int next = 0;
        for (Edge<T> edge : connection.getEdges()) {
            if (next < retainedNodes.size() && retainedNodes.get(next) == edge.getNode()) {
                edges.add(edge);
                next++;
            }
        }
        PageInfo pageInfo = connection.getPageInfo();
        ConnectionCursor startCursor = edges.isEmpty() ? null : edges.get(0).getCursor();
        ConnectionCursor endCursor = edges.isEmpty() ? null : edges.get(edges.size() - 1).getCursor();
        return new DefaultConnection<>(edges, new DefaultPageInfo(startCursor, endCursor,
                pageInfo != null && pageInfo.isHasPreviousPage(), pageInfo != null && pageInfo.isHasNextPage()));
    }

    private Principal principalOf(DataFetchingEnvironment environment) {
        Principal principal = environment.getGraphQlContext().get(Principal.class);
        if (principal == null) {
            log.debug("No principal in GraphQL context, using {}", fallbackPrincipal);
            return fallbackPrincipal;
        }
        return principal;
    }
}
