package com.flipkart.fieldguard.configuration;

import org.springframework.boot.autoconfigure.graphql.GraphQlSourceBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.graphql.execution.ConnectionTypeDefinitionConfigurer;

@Configuration
public class GraphQlSchemaConfiguration {

    /**
     * Generates the {@code Connection}, {@code Edge} and {@code PageInfo} types of every field typed
     * {@code <Type>Connection} in the schema files.
     */
    @Bean
    public GraphQlSourceBuilderCustomizer connectionTypesCustomizer() {
        return builder -> builder.configureTypeDefinitions(new ConnectionTypeDefinitionConfigurer());
    }
}
