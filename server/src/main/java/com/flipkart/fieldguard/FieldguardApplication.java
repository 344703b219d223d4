package com.flipkart.fieldguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FieldguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldguardApplication.class, args);
    }
}
