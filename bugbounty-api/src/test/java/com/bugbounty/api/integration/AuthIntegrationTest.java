package com.bugbounty.api.integration;

import com.bugbounty.api.auth.JwtTokenService;
import com.bugbounty.core.domain.User;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Registration, login and identity resolution over HTTP.
 */
class AuthIntegrationTest extends IntegrationTestSupport {

    @Test
    void register_returnsTokenAndUserWithoutPasswordHash() throws Exception {
        String email = uniqueEmail("alice");

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Alice", "email", email, "password", PASSWORD))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token", not(emptyString())))
                .andExpect(jsonPath("$.user.email").value(email))
                .andExpect(jsonPath("$.user.role").value("RESEARCHER"))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist())
                .andExpect(jsonPath("$.user.password").doesNotExist());

        User stored = userRepository.findByEmail(email).orElseThrow();
        assertThat(stored.getPasswordHash()).isNotEqualTo(PASSWORD);
        assertThat(passwordEncoder.matches(PASSWORD, stored.getPasswordHash())).isTrue();
    }

    @Test
    void register_withLongName_isCreated() throws Exception {
        String longName = "N".repeat(300);

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", longName, "email", uniqueEmail("long"), "password", PASSWORD))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.name").value(longName));
    }

    @Test
    void register_withMissingField_isRejected() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", uniqueEmail("nameless"), "password", PASSWORD))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("All fields are required"));
    }

    @Test
    void register_withTakenEmail_conflicts() throws Exception {
        String email = uniqueEmail("taken");
        String body = json(Map.of("name", "First", "email", email, "password", PASSWORD));

        mockMvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("A user with this email already exists"));

        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    void register_asAdmin_isForbidden() throws Exception {
        String email = uniqueEmail("root");

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Root", "email", email, "password", PASSWORD, "role", "ADMIN"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Role ADMIN cannot be self-assigned"));

        assertThat(userRepository.existsByEmail(email)).isFalse();
    }

    @Test
    void register_withUnknownRole_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "X", "email", uniqueEmail("x"), "password", PASSWORD, "role", "OWNER"))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void login_withValidCredentials_returnsToken() throws Exception {
        String email = uniqueEmail("bob");
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Bob", "email", email, "password", PASSWORD, "role", "COMPANY"))))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", email, "password", PASSWORD))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token", not(emptyString())))
                .andExpect(jsonPath("$.user.role").value("COMPANY"))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist());
    }

    @Test
    void login_withWrongPasswordOrUnknownEmail_failsIdentically() throws Exception {
        String email = uniqueEmail("carol");
        registerWith(email);

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", email, "password", "wrong-password"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid email or password"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", uniqueEmail("nobody"), "password", PASSWORD))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid email or password"));
    }

    @Test
    void me_returnsCurrentUser() throws Exception {
        String token = registerAs(User.Role.RESEARCHER);

        mockMvc.perform(withToken(get("/api/auth/me"), token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.role").value("RESEARCHER"))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist());
    }

    @Test
    void me_withoutToken_isUnauthorized() throws Exception {
        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401))
                .andExpect(jsonPath("$.error").value("No token provided, authorization denied"));
    }

    @Test
    void me_withMalformedHeaderOrGarbageToken_isUnauthorized() throws Exception {
        String token = registerAs(User.Role.RESEARCHER);

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Token " + token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("No token provided, authorization denied"));

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid token"));
    }

    @Test
    void me_withExpiredToken_isUnauthorized() throws Exception {
        User user = userRepository.save(User.register(
                uniqueEmail("late"), "Late", passwordEncoder.encode(PASSWORD), User.Role.RESEARCHER));
        JwtTokenService expiring = new JwtTokenService("test-signing-secret-with-at-least-32-characters", -60);
        String expired = expiring.issue(user).token();

        mockMvc.perform(withToken(get("/api/auth/me"), expired))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid token"));
    }

    @Test
    void me_forDeletedUser_isUnauthorized() throws Exception {
        String email = uniqueEmail("gone");
        String token = registerWith(email);
        userRepository.delete(userRepository.findByEmail(email).orElseThrow());

        mockMvc.perform(withToken(get("/api/auth/me"), token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("User not found"));
    }

    private String registerWith(String email) throws Exception {
        String body = mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Someone", "email", email, "password", PASSWORD))))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.token");
    }
}
