package com.flipkart.fieldguard.models.resolved;

/**
 * Scalars, null and non-entity objects. Always passed through.
 */
public record PlainValue(Object value) implements OtherValue {

    public static final PlainValue NULL = new PlainValue(null);

    @Override
    public Object raw() {
        return value;
    }
}
