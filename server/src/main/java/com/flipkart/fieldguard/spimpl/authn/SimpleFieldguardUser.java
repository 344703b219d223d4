package com.flipkart.fieldguard.spimpl.authn;

import com.flipkart.fieldguard.spi.authn.FieldguardUser;

public record SimpleFieldguardUser(String name, boolean superuser, boolean anonymous) implements FieldguardUser {

    public static final SimpleFieldguardUser ANONYMOUS = new SimpleFieldguardUser("anonymous", false, true);

    public SimpleFieldguardUser(String name, boolean superuser) {
        this(name, superuser, false);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isSuperuser() {
        return superuser;
    }

    @Override
    public boolean isAnonymous() {
        return anonymous;
    }
}
