package com.taskboard.servicebackend.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskboard.servicebackend.task.TaskRepository;
import com.taskboard.servicebackend.user.AppUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;
    @Autowired TaskRepository taskRepository;
    @Autowired AppUserRepository userRepository;

    @BeforeEach
    void cleanDatabase() {
        taskRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    private ResultActions postJson(String path, String json) throws Exception {
        return mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(json));
    }

    private String register(String name, String email, String password) throws Exception {
        String body = postJson("/api/auth/register",
                "{\"name\":\"" + name + "\",\"email\":\"" + email + "\",\"password\":\"" + password + "\"}")
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return json.path("data").path("token").asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    @Test
    void registerReturnsTokenAndProfile() throws Exception {
        postJson("/api/auth/register", "{\"name\":\"Ada Lovelace\",\"email\":\"ada@example.com\",\"password\":\"engine1\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.token").isNotEmpty())
                .andExpect(jsonPath("$.data.user.name").value("Ada Lovelace"))
                .andExpect(jsonPath("$.data.user.email").value("ada@example.com"))
                .andExpect(jsonPath("$.data.user.created_at").isNotEmpty())
                .andExpect(jsonPath("$.data.user.password").doesNotExist())
                .andExpect(jsonPath("$.data.user.passwordHash").doesNotExist());
    }

    @Test
    void duplicateEmailIsAConflict() throws Exception {
        register("Ada Lovelace", "ada@example.com", "engine1");

        postJson("/api/auth/register", "{\"name\":\"Other Ada\",\"email\":\"ada@example.com\",\"password\":\"engine2\"}")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Email is already registered"));
    }

    @Test
    void invalidRegistrationIsRejected() throws Exception {
        postJson("/api/auth/register", "{\"name\":\"Al\",\"email\":\"not-an-email\",\"password\":\"123\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors.length()").value(3))
                .andExpect(jsonPath("$.errors").value(hasItem("email must be valid")));
    }

    @Test
    void nameLengthIsCheckedAfterTrimming() throws Exception {
        postJson("/api/auth/register", "{\"name\":\"  x   \",\"email\":\"x@example.com\",\"password\":\"engine1\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors").value(hasItem("name must be between 3 and 200 characters")));
        assertThat(userRepository.existsByEmail("x@example.com")).isFalse();

        String token = register("  Ada  ", " ada@example.com ", "engine1");
        mvc.perform(get("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(jsonPath("$.data.user.name").value("Ada"))
                .andExpect(jsonPath("$.data.user.email").value("ada@example.com"));

        mvc.perform(put("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"  y  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors").value(hasItem("name must be between 3 and 200 characters")));
        mvc.perform(get("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(jsonPath("$.data.user.name").value("Ada"));
    }

    @Test
    void loginFailureDoesNotRevealWhichPartWasWrong() throws Exception {
        register("Ada Lovelace", "ada@example.com", "engine1");

        String wrongPassword = postJson("/api/auth/login", "{\"email\":\"ada@example.com\",\"password\":\"nope123\"}")
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();
        String unknownEmail = postJson("/api/auth/login", "{\"email\":\"nobody@example.com\",\"password\":\"engine1\"}")
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();

        assertThat(wrongPassword).isEqualTo(unknownEmail);
        assertThat(objectMapper.readTree(wrongPassword).path("message").asText())
                .isEqualTo("Incorrect email or password");
    }

    @Test
    void loginReturnsAWorkingToken() throws Exception {
        register("Ada Lovelace", "ada@example.com", "engine1");

        String body = postJson("/api/auth/login", "{\"email\":\"ada@example.com\",\"password\":\"engine1\"}")
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String token = objectMapper.readTree(body).path("data").path("token").asText();

        mvc.perform(get("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.user.email").value("ada@example.com"));
    }

    @Test
    void profileNeedsAToken() throws Exception {
        mvc.perform(get("/api/auth/profile"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Access token required"));

        mvc.perform(get("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer("garbage")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid token"));
    }

    @Test
    void updateProfile() throws Exception {
        String token = register("Ada Lovelace", "ada@example.com", "engine1");
        register("Charles Babbage", "charles@example.com", "engine2");

        mvc.perform(put("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"Countess Ada\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.user.name").value("Countess Ada"))
                .andExpect(jsonPath("$.data.user.email").value("ada@example.com"));

        mvc.perform(put("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"email\":\"charles@example.com\"}"))
                .andExpect(status().isConflict());

        mvc.perform(put("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No valid field supplied for update"));
    }

    @Test
    void changePassword() throws Exception {
        String token = register("Ada Lovelace", "ada@example.com", "engine1");

        mvc.perform(put("/api/auth/change-password").header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentPassword\":\"wrong99\",\"newPassword\":\"engine2\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Current password is incorrect"));

        mvc.perform(put("/api/auth/change-password").header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentPassword\":\"engine1\",\"newPassword\":\"engine1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("New password must differ from the current password"));

        mvc.perform(put("/api/auth/change-password").header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentPassword\":\"engine1\",\"newPassword\":\"engine2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        postJson("/api/auth/login", "{\"email\":\"ada@example.com\",\"password\":\"engine1\"}")
                .andExpect(status().isUnauthorized());
        postJson("/api/auth/login", "{\"email\":\"ada@example.com\",\"password\":\"engine2\"}")
                .andExpect(status().isOk());
    }

    @Test
    void validateTokenAndLogout() throws Exception {
        String token = register("Ada Lovelace", "ada@example.com", "engine1");

        mvc.perform(post("/api/auth/validate-token").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.user.name").value("Ada Lovelace"));

        mvc.perform(post("/api/auth/logout").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logout successful"));
    }

    @Test
    void tokenOfADeletedUserIsRejected() throws Exception {
        String token = register("Ada Lovelace", "ada@example.com", "engine1");
        userRepository.deleteAllInBatch();

        mvc.perform(get("/api/auth/profile").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid token"));
    }
}
