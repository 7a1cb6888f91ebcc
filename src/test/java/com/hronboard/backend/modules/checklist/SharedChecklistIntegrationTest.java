package com.hronboard.backend.modules.checklist;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hronboard.backend.support.AbstractPostgresIntegrationTest;
import com.hronboard.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class SharedChecklistIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Onboard#2025";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    private String hrToken;
    private String employeeToken;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureHrManager("hr@hr-onboarding.test", PASSWORD);
        testUserFactory.ensureEmployee("employee@hr-onboarding.test", PASSWORD);
        hrToken = login("hr@hr-onboarding.test");
        employeeToken = login("employee@hr-onboarding.test");
    }

    @Test
    void sharedChecklistIsReadableWithoutSigningIn() throws Exception {
        JsonNode shared = readJson(mockMvc.perform(post("/api/checklist/share")
                        .header("Authorization", bearer(hrToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "checklist", List.of(
                                        Map.of("title", "Complete the DPAE declaration", "category", "legal"),
                                        Map.of("title", "Book the occupational health visit", "category", "legal")),
                                "role", "Backend developer",
                                "department", "Engineering"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slug").isNotEmpty()));
        String slug = shared.path("slug").asText();

        mockMvc.perform(get(shared.path("shareUrl").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checklist.length()").value(2))
                .andExpect(jsonPath("$.checklist[0].title").value("Complete the DPAE declaration"))
                .andExpect(jsonPath("$.role").value("Backend developer"))
                .andExpect(jsonPath("$.department").value("Engineering"))
                .andExpect(jsonPath("$.createdAt").isNotEmpty());

        mockMvc.perform(get("/api/checklist/c/{slug}", slug).header("Authorization", bearer(employeeToken)))
                .andExpect(status().isOk());
    }

    @Test
    void malformedAndUnknownSlugs() throws Exception {
        mockMvc.perform(get("/api/checklist/c/{slug}", "bad_slug"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("checklists.invalid_slug"));

        mockMvc.perform(get("/api/checklist/c/{slug}", "abcDEF1234"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("checklists.not_found"));
    }

    @Test
    void sharingNeedsAChecklistArray() throws Exception {
        mockMvc.perform(post("/api/checklist/share")
                        .header("Authorization", bearer(hrToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "Designer"))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/checklist/share")
                        .header("Authorization", bearer(hrToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("checklist", "not an array"))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void sharingIsLimitedToChecklistAuthors() throws Exception {
        String body = json(Map.of("checklist", List.of(Map.of("title", "Say hello"))));

        mockMvc.perform(post("/api/checklist/share")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/checklist/share")
                        .header("Authorization", bearer(employeeToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden());
    }

    private String login(String email) throws Exception {
        JsonNode response = readJson(mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", email, "password", PASSWORD))))
                .andExpect(status().isOk()));
        return response.path("token").asText();
    }

    private JsonNode readJson(org.springframework.test.web.servlet.ResultActions actions) throws Exception {
        return objectMapper.readTree(actions.andReturn().getResponse().getContentAsString());
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
