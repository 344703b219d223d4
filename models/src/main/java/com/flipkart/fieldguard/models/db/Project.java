package com.flipkart.fieldguard.models.db;

import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.OwnedEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Project implements OwnedEntity {

    public static final EntityKind KIND = EntityKind.of("tracker", "project");

    private String id;
    private String name;

    /**
     * Never null.
     */
    private UserAccount owner;

    @Override
    public EntityKind getEntityKind() {
        return KIND;
    }

    @Override
    public String getOwnerName() {
        return owner == null ? null : owner.getUsername();
    }
}
