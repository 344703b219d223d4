package com.flipkart.fieldguard.models.resolved;

import com.flipkart.fieldguard.models.exception.PermissionDeniedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The decision taken for one resolved field value.
 */
public sealed interface AuthorizedOutcome
        permits AuthorizedOutcome.PassThrough, AuthorizedOutcome.Filtered, AuthorizedOutcome.Redacted, AuthorizedOutcome.Denied {

    /**
     * Returns the value the engine should use in place of the resolved one.
     *
     * @throws PermissionDeniedException if the field was denied
     */
    Object unwrap();

    static AuthorizedOutcome passThrough(Object value) {
        return new PassThrough(value);
    }

    static AuthorizedOutcome filtered(List<?> retained) {
        return new Filtered(retained);
    }

    static AuthorizedOutcome redacted() {
        return Redacted.INSTANCE;
    }

    static AuthorizedOutcome denied(PermissionDeniedException error) {
        return new Denied(error);
    }

    /**
     * The resolved value is returned unchanged.
     */
    record PassThrough(Object value) implements AuthorizedOutcome {
        @Override
        public Object unwrap() {
            return value;
        }
    }

    /**
     * Only the permitted members of a collection are kept, in their original order.
     */
    record Filtered(List<?> retained) implements AuthorizedOutcome {
        public Filtered {
            retained = Collections.unmodifiableList(new ArrayList<>(retained));
        }

        @Override
        public Object unwrap() {
            return retained;
        }
    }

    /**
     * A denied nullable value is replaced by null.
     */
    record Redacted() implements AuthorizedOutcome {
        private static final Redacted INSTANCE = new Redacted();

        @Override
        public Object unwrap() {
            return null;
        }
    }

    /**
     * A denied non-null value fails the field.
     */
    record Denied(PermissionDeniedException error) implements AuthorizedOutcome {
        public Denied {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public Object unwrap() {
            throw error;
        }
    }
}
