package com.flipkart.fieldguard.models.resolved;

/**
 * A value that is neither a single entity nor a single-kind collection.
 */
public sealed interface OtherValue extends ResolvedValue permits PlainValue, MixedSequenceValue {
}
