package com.flipkart.fieldguard.models.db;

import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.OwnedEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An amount spent by a user, optionally booked against a {@link Project}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Expense implements OwnedEntity {

    public static final EntityKind KIND = EntityKind.of("tracker", "expense");

    private String id;
    private int amount;
    private UserAccount owner;

    /**
     * Optional, an expense may not belong to any project.
     */
    private Project project;

    @Override
    public EntityKind getEntityKind() {
        return KIND;
    }

    @Override
    public String getOwnerName() {
        return owner == null ? null : owner.getUsername();
    }
}
