package com.flipkart.fieldguard.configuration;

import com.flipkart.fieldguard.authz.FieldAuthorizationInterceptor;
import com.flipkart.fieldguard.authz.FieldguardSecurity;
import com.flipkart.fieldguard.authz.ResolvedValueClassifier;
import com.flipkart.fieldguard.graphql.FieldAuthorizationInstrumentation;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FieldAuthorizationConfiguration {

    /**
     * Picked up by Spring Boot's GraphQL auto-configuration, which registers every Instrumentation bean with the engine.
     */
    @Bean
    @ConditionalOnProperty(prefix = "authorization", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FieldAuthorizationInstrumentation fieldAuthorizationInstrumentation(FieldAuthorizationInterceptor interceptor,
                                                                               ResolvedValueClassifier classifier,
                                                                               FieldguardSecurity fieldguardSecurity,
                                                                               MeterRegistry meterRegistry) {
        return new FieldAuthorizationInstrumentation(interceptor, classifier, fieldguardSecurity.anonymousPrincipal(), meterRegistry);
    }
}
