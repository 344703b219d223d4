package com.flipkart.fieldguard.spi.models;

/**
 * A domain object whose visibility is controlled per entity kind and per instance.
 * The instance itself is the handle passed to instance-scoped permission checks.
 */
public interface GuardedEntity {

    EntityKind getEntityKind();
}
