package com.flipkart.fieldguard.configuration.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Getter
@Setter
@ConfigurationProperties(prefix = "authorization")
@Validated
public class AuthorizationProperties {

    /**
     * when false, resolved fields are returned without any permission check
     */
    private boolean enabled = true;

    @Valid
    private List<Rule> rules = new ArrayList<>();

    /**
     * permissions granted on every instance whose owner is the requesting user, e.g. tracker.view_project
     */
    @NotNull
    private Set<String> ownerPermissions = new HashSet<>();

    @Getter
    @Setter
    public static class Rule {
        /**
         * user name, or * for every authenticated user
         */
        @NotEmpty
        private String user;
        /**
         * permission names, or * for all of them
         */
        private List<String> permissions;
    }
}
