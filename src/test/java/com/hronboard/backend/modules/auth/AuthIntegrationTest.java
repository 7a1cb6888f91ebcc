package com.hronboard.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hronboard.backend.modules.auth.application.TokenHashing;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.hronboard.backend.support.AbstractPostgresIntegrationTest;
import com.hronboard.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ADMIN_EMAIL = "admin@hr-onboarding.test";
    private static final String ADMIN_PASSWORD = "Admin#Pass1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private UserSessionRepository userSessionRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        testUserFactory.ensureAdmin(ADMIN_EMAIL, ADMIN_PASSWORD);
    }

    @Test
    void selfRegistrationCreatesEmployeeWhoCanLogIn() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "email", "Jamie.Doe@Example.com",
                                "password", "Welcome#2025",
                                "firstName", "Jamie",
                                "lastName", "Doe"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.email").value("jamie.doe@example.com"))
                .andExpect(jsonPath("$.user.role").value("employee"))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist());

        String token = login("jamie.doe@example.com", "Welcome#2025").path("token").asText();

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("jamie.doe@example.com"))
                .andExpect(jsonPath("$.permissions[?(@ == 'templates:view')]").exists())
                .andExpect(jsonPath("$.permissions[?(@ == 'templates:create')]").doesNotExist());
    }

    @Test
    void anonymousCannotRegisterHrManager() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "email", "sneaky@example.com",
                                "password", "Welcome#2025",
                                "firstName", "Sneaky",
                                "lastName", "Person",
                                "role", "hr_manager"))))
                .andExpect(status().isForbidden());
    }

    @Test
    void weakPasswordIsRejected() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "email", "weak@example.com",
                                "password", "password",
                                "firstName", "Weak",
                                "lastName", "Password"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));
    }

    @Test
    void sessionStoresOnlyTheTokenHash() throws Exception {
        JsonNode login = login(ADMIN_EMAIL, ADMIN_PASSWORD);
        String token = login.path("token").asText();

        AppUser admin = appUserRepository.findByEmailIgnoreCase(ADMIN_EMAIL).orElseThrow();
        assertThat(admin.getLastLoginAt()).isNotNull();
        assertThat(userSessionRepository.findAll())
                .singleElement()
                .satisfies(session -> {
                    assertThat(session.getTokenHash()).isEqualTo(TokenHashing.sha256Hex(token));
                    assertThat(session.getTokenHash()).isNotEqualTo(token);
                });
    }

    @Test
    void fifthWrongPasswordLocksTheAccount() throws Exception {
        for (int attempt = 1; attempt <= 4; attempt++) {
            attemptLogin(ADMIN_EMAIL, "Wrong#Pass1")
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.detail").value("Invalid email or password"));
        }

        attemptLogin(ADMIN_EMAIL, "Wrong#Pass1")
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.lockTimeRemaining").value(15));

        attemptLogin(ADMIN_EMAIL, ADMIN_PASSWORD)
                .andExpect(status().isLocked());
    }

    @Test
    void unknownEmailLooksLikeWrongPassword() throws Exception {
        attemptLogin("nobody@example.com", "Whatever#1")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));
    }

    @Test
    void logoutInvalidatesTheToken() throws Exception {
        String token = login(ADMIN_EMAIL, ADMIN_PASSWORD).path("token").asText();

        mockMvc.perform(post("/api/auth/logout").header("Authorization", "Bearer " + token))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.session_invalid"));
    }

    @Test
    void expiredSessionIsRejectedEvenWithAValidToken() throws Exception {
        JsonNode login = login(ADMIN_EMAIL, ADMIN_PASSWORD);
        String token = login.path("token").asText();
        UUID sessionId = UUID.fromString(login.path("sessionId").asText());

        jdbcTemplate.update("UPDATE user_session SET expires_at = now() - interval '1 minute' WHERE id = ?", sessionId);

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.session_invalid"));
    }

    @Test
    void sessionOfDeactivatedUserIsRejected() throws Exception {
        testUserFactory.ensureEmployee("leaver@hr-onboarding.test", "Leaver#Pass1");
        JsonNode login = login("leaver@hr-onboarding.test", "Leaver#Pass1");
        String token = login.path("token").asText();
        UUID userId = UUID.fromString(login.path("user").path("id").asText());

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());

        // only the account flag flips; the session row stays active
        jdbcTemplate.update("UPDATE app_user SET is_active = false WHERE id = ?", userId);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT count(*) FROM user_session WHERE user_id = ? AND is_active = true", Integer.class, userId))
                .isEqualTo(1);

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.session_invalid"));
    }

    @Test
    void refreshRotatesTokenOnTheSameSession() throws Exception {
        JsonNode login = login(ADMIN_EMAIL, ADMIN_PASSWORD);
        String original = login.path("token").asText();

        String body = mockMvc.perform(post("/api/auth/refresh").header("Authorization", "Bearer " + original))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value(login.path("sessionId").asText()))
                .andReturn()
                .getResponse()
                .getContentAsString();
        String refreshed = objectMapper.readTree(body).path("token").asText();

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + original))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + refreshed))
                .andExpect(status().isOk());
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/templates"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    private JsonNode login(String email, String password) throws Exception {
        String body = attemptLogin(email, password)
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(body);
    }

    private ResultActions attemptLogin(String email, String password) throws Exception {
        return mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("email", email, "password", password))));
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }
}
