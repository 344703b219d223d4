package com.flipkart.fieldguard.spi.models;

/**
 * An entity that belongs to one user. Owner based backends grant instance permissions from it.
 */
public interface OwnedEntity extends GuardedEntity {

    /**
     * @return the name of the owning user, or null if the entity has no owner
     */
    String getOwnerName();
}
