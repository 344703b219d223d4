package com.flipkart.fieldguard.configuration.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "authentication")
@Validated
public class AuthenticationProperties {

    @Valid
    private List<User> users = new ArrayList<>();

    @Getter
    @Setter
    public static class User {
        @NotEmpty
        private String name;
        /**
         * encoded password including the encoder id, e.g. {noop}secret or {bcrypt}...
         */
        @NotEmpty
        private String password;
        private boolean superuser;
    }
}
