package com.flipkart.fieldguard.exception;

import com.flipkart.fieldguard.models.exception.PermissionDeniedException;
import graphql.GraphQLError;
import graphql.Scalars;
import graphql.execution.ExecutionStepInfo;
import graphql.execution.ResultPath;
import graphql.language.Field;
import graphql.language.SourceLocation;
import graphql.schema.DataFetchingEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FieldguardExceptionResolverTest {

    private final FieldguardExceptionResolver exceptionResolver = new FieldguardExceptionResolver();

    private final DataFetchingEnvironment environment = mock();

    @BeforeEach
    void setUp() {
        ExecutionStepInfo stepInfo = ExecutionStepInfo.newExecutionStepInfo()
                .type(Scalars.GraphQLString)
                .path(ResultPath.fromList(List.of("expense", "project")))
                .build();
        when(environment.getField()).thenReturn(Field.newField("project").sourceLocation(new SourceLocation(1, 12)).build());
        when(environment.getExecutionStepInfo()).thenReturn(stepInfo);
    }

    @Test
    void permissionDenied_IsForbiddenAtTheDeniedFieldPath() {
        PermissionDeniedException exception = new PermissionDeniedException(List.<Object>of("expense", "project", "owner"));

        GraphQLError error = exceptionResolver.resolveToSingleError(exception, environment);

        assertNotNull(error);
        assertEquals(ErrorType.FORBIDDEN, error.getErrorType());
        assertEquals(PermissionDeniedException.DEFAULT_MESSAGE, error.getMessage());
        assertEquals(List.of("expense", "project", "owner"), error.getPath());
    }

    @Test
    void responseStatusNotFound_IsNotFound() {
        ResponseStatusException exception = new ResponseStatusException(HttpStatus.NOT_FOUND, "Project not found: p9");

        GraphQLError error = exceptionResolver.resolveToSingleError(exception, environment);

        assertNotNull(error);
        assertEquals(ErrorType.NOT_FOUND, error.getErrorType());
        assertEquals("Project not found: p9", error.getMessage());
        assertEquals(List.of("expense", "project"), error.getPath());
    }

    @Test
    void otherExceptions_AreLeftToDefaultHandling() {
        assertNull(exceptionResolver.resolveToSingleError(new IllegalStateException("backend down"), environment));
        assertNull(exceptionResolver.resolveToSingleError(new ResponseStatusException(HttpStatus.BAD_REQUEST), environment));
    }
}
