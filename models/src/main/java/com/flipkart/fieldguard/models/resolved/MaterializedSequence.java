package com.flipkart.fieldguard.models.resolved;

import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.GuardedEntity;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

public record MaterializedSequence<T extends GuardedEntity>(EntityKind kind, List<T> members) implements EntitySequence<T> {

    public MaterializedSequence {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(members, "members");
    }

    @Override
    public Iterator<T> iterator() {
        return members.iterator();
    }
}
