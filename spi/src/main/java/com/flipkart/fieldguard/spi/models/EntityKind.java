package com.flipkart.fieldguard.spi.models;

import java.util.Objects;

/**
 * Identity metadata of an entity type: the namespace it is declared in and its kind name.
 * Permission names are derived from it, so the namespace must not contain a {@code '.'}.
 */
public record EntityKind(String namespace, String name) {

    public EntityKind {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        if (namespace.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("Entity kind needs a namespace and a name, got '" + namespace + "' and '" + name + "'");
        }
        if (namespace.indexOf('.') >= 0) {
            throw new IllegalArgumentException("Namespace must not contain '.': " + namespace);
        }
    }

    public static EntityKind of(String namespace, String name) {
        return new EntityKind(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "." + name;
    }
}
