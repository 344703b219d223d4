package com.flipkart.fieldguard.models.resolved;

/**
 * The value produced by one field resolver, classified by shape at the boundary with the GraphQL engine.
 * <ul>
 *   <li>{@link EntityValue}: a single guarded entity</li>
 *   <li>{@link CollectionValue}: entities of one kind, lazily fetched or already materialized</li>
 *   <li>{@link OtherValue}: anything else, including sequences that mix entities and plain values</li>
 * </ul>
 */
public sealed interface ResolvedValue permits EntityValue, CollectionValue, OtherValue {

    /**
     * @return the value exactly as the resolver returned it
     */
    Object raw();
}
