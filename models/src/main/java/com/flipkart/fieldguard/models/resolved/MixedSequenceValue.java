package com.flipkart.fieldguard.models.resolved;

import java.util.List;
import java.util.Objects;

/**
 * An in-memory sequence whose members may be entities of any kind or plain values.
 * A resolver returning a plain {@code List} of entities instead of a query backed collection lands here too.
 */
public record MixedSequenceValue(List<?> members) implements OtherValue {

    public MixedSequenceValue {
        Objects.requireNonNull(members, "members");
    }

    @Override
    public Object raw() {
        return members;
    }
}
