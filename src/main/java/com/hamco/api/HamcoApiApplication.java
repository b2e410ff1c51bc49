package com.hamco.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// Identities come from JWTs and API keys only; no in-memory user store
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class HamcoApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(HamcoApiApplication.class, args);
    }
}
