package com.flipkart.fieldguard.models.db;

import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.OwnedEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A registered user. Every user owns its own account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount implements OwnedEntity {

    public static final EntityKind KIND = EntityKind.of("auth", "user");

    private String id;
    private String username;
    private String firstName;
    private String lastName;

    @Override
    public EntityKind getEntityKind() {
        return KIND;
    }

    @Override
    public String getOwnerName() {
        return username;
    }
}
