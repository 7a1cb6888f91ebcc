package com.hronboard.backend.global.config;

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
 * Verifies required configuration once the application is up and refuses to keep running without it.
 */
@Component
public class EnvironmentValidator {

    static final String DEV_JWT_SECRET = "dev-only-hr-onboarding-secret-change-me-0123456789";

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "auth.lockout.max-attempts",
            "auth.lockout.duration-minutes"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        String jwtSecret = environment.getProperty("jwt.secret");
        if (DEV_JWT_SECRET.equals(jwtSecret)) {
            log.warn("jwt.secret is the development default; set JWT_SECRET outside local runs");
        } else if (jwtSecret != null && !jwtSecret.isBlank() && jwtSecret.length() < 32) {
            problems.add("jwt.secret must be at least 32 characters");
        }

        requirePositive("jwt.expiration", problems);
        requirePositive("auth.lockout.max-attempts", problems);
        requirePositive("auth.lockout.duration-minutes", problems);
        return problems;
    }

    private void requirePositive(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            if (Long.parseLong(raw.trim()) <= 0) {
                problems.add(key + " must be positive");
            }
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number");
        }
    }
}
