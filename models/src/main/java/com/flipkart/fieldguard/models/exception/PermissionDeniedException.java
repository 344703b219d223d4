package com.flipkart.fieldguard.models.exception;

import org.springframework.security.access.AccessDeniedException;

import java.util.List;

/**
 * Raised when a non-null field resolves to an entity the principal may not view.
 * Carries the response path so the error can be reported next to the data of the sibling fields.
 */
public class PermissionDeniedException extends AccessDeniedException {

    public static final String DEFAULT_MESSAGE = "You do not have permission to access this field";

    private final transient List<Object> path;

    public PermissionDeniedException(List<Object> path) {
        this(DEFAULT_MESSAGE, path);
    }

    public PermissionDeniedException(String message, List<Object> path) {
        super(message);
        this.path = List.copyOf(path);
    }

    public List<Object> getPath() {
        return path;
    }
}
