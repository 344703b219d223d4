package com.flipkart.fieldguard.repositories;

import com.flipkart.fieldguard.models.db.UserAccount;
import org.springframework.stereotype.Repository;

@Repository
public class UserAccountRepository extends InMemoryRepository<UserAccount> {

    public UserAccountRepository() {
        super(UserAccount.KIND);
    }

    @Override
    protected String idOf(UserAccount entity) {
        return entity.getId();
    }

    @Override
    protected void assignId(UserAccount entity, String id) {
        entity.setId(id);
    }
}
