package com.flipkart.fieldguard.models.resolved;

import java.util.List;
import java.util.Objects;

/**
 * Per-field metadata supplied by the GraphQL engine.
 *
 * @param nonNull whether the field's declared type is non-null
 * @param path    field names and list indices from the query root to this field
 */
public record FieldContext(boolean nonNull, List<Object> path) {

    public FieldContext {
        path = List.copyOf(Objects.requireNonNull(path, "path"));
    }

    public static FieldContext nullable(Object... path) {
        return new FieldContext(false, List.of(path));
    }

    public static FieldContext nonNull(Object... path) {
        return new FieldContext(true, List.of(path));
    }
}
