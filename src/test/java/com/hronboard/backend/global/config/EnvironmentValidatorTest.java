package com.hronboard.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/hr_onboarding")
                .withProperty("jwt.secret", "a-production-grade-secret-with-plenty-of-length")
                .withProperty("jwt.expiration", "604800000")
                .withProperty("auth.lockout.max-attempts", "5")
                .withProperty("auth.lockout.duration-minutes", "15");
    }

    @Test
    void completeConfigurationPasses() {
        assertThat(new EnvironmentValidator(validEnvironment()).validate()).isEmpty();
    }

    @Test
    void developmentSecretOnlyWarns() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);

        assertThat(new EnvironmentValidator(environment).validate()).isEmpty();
    }

    @Test
    void reportsEveryProblemAtOnce() {
        MockEnvironment environment = validEnvironment()
                .withProperty("spring.datasource.url", " ")
                .withProperty("jwt.secret", "short")
                .withProperty("jwt.expiration", "soon")
                .withProperty("auth.lockout.max-attempts", "0");

        assertThat(new EnvironmentValidator(environment).validate()).containsExactlyInAnyOrder(
                "spring.datasource.url is missing",
                "jwt.secret must be at least 32 characters",
                "jwt.expiration must be a number",
                "auth.lockout.max-attempts must be positive"
        );
    }

    @Test
    void startupFailsOnInvalidConfiguration() {
        MockEnvironment environment = validEnvironment().withProperty("auth.lockout.duration-minutes", "-1");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("auth.lockout.duration-minutes must be positive");
    }
}
