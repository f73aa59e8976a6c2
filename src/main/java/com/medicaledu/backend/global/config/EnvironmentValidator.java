package com.medicaledu.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required configuration is missing or obviously unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_JWT_SECRET = "dev-jwt-secret-key-change-in-production-medicaledu";
    private static final int MIN_SECRET_LENGTH = 32;
    private static final long MIN_EXPIRATION_MS = 300_000L;
    private static final long MAX_EXPIRATION_MS = 86_400_000L;

    private static final List<String> REQUIRED_PROPERTIES = List.of(
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    );

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + ": missing");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        jwtSecret.filter(secret -> secret.length() < MIN_SECRET_LENGTH)
                .ifPresent(secret -> problems.add("jwt.secret: must be at least " + MIN_SECRET_LENGTH + " characters"));
        if (jwtSecret.filter(DEFAULT_JWT_SECRET::equals).isPresent()) {
            log.warn("jwt.secret is the development default; set JWT_SECRET before deploying");
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long value = Long.parseLong(expiration.trim());
                if (value < MIN_EXPIRATION_MS || value > MAX_EXPIRATION_MS) {
                    problems.add("jwt.expiration: must be between " + MIN_EXPIRATION_MS + " and " + MAX_EXPIRATION_MS + " ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration: must be numeric");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }

        log.info("Environment validation passed");
    }
}
