package com.bugbounty.api.integration;

import com.bugbounty.core.domain.User;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for per-IP rate limiting.
 */
class RateLimitIntegrationTest extends IntegrationTestSupport {

    @Test
    void rateLimitHeaders_arePresentOnApiRoutes() throws Exception {
        mockMvc.perform(get("/api/health").with(fromIp("10.0.0.1")))
                .andExpect(status().isOk())
                .andExpect(header().string("RateLimit-Limit", "100"))
                .andExpect(header().string("RateLimit-Remaining", "99"))
                .andExpect(header().exists("RateLimit-Reset"));
    }

    @Test
    void sixthFailedLogin_isRejectedWith429() throws Exception {
        for (int attempt = 1; attempt <= 5; attempt++) {
            failedLogin("10.0.0.2").andExpect(status().isUnauthorized());
        }

        failedLogin("10.0.0.2")
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(header().string("RateLimit-Limit", "5"))
                .andExpect(header().string("RateLimit-Remaining", "0"))
                .andExpect(header().exists("RateLimit-Reset"))
                .andExpect(jsonPath("$.error", containsString("Too many authentication attempts")))
                .andExpect(jsonPath("$.retryAfter").value("15 minutes"));
    }

    @Test
    void authenticationLimit_isTrackedPerClientAddress() throws Exception {
        for (int attempt = 1; attempt <= 5; attempt++) {
            failedLogin("10.0.0.3").andExpect(status().isUnauthorized());
        }
        failedLogin("10.0.0.3").andExpect(status().isTooManyRequests());

        failedLogin("10.0.0.4").andExpect(status().isUnauthorized());
    }

    @Test
    void successfulAuthentication_doesNotConsumeTheBudget() throws Exception {
        String email = uniqueEmail("steady");
        mockMvc.perform(post("/api/auth/register")
                        .with(fromIp("10.0.0.5"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Steady", "email", email, "password", PASSWORD))))
                .andExpect(status().isCreated());

        for (int attempt = 1; attempt <= 4; attempt++) {
            failedLogin("10.0.0.5").andExpect(status().isUnauthorized());
        }
        for (int attempt = 1; attempt <= 3; attempt++) {
            mockMvc.perform(post("/api/auth/login")
                            .with(fromIp("10.0.0.5"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(Map.of("email", email, "password", PASSWORD))))
                    .andExpect(status().isOk());
        }

        failedLogin("10.0.0.5").andExpect(status().isUnauthorized());
        failedLogin("10.0.0.5").andExpect(status().isTooManyRequests());
    }

    @Test
    void rejectedRequest_doesNotReachTheHandler() throws Exception {
        String company = registerAs(User.Role.COMPANY);
        for (int i = 1; i <= 5; i++) {
            createProgram(company, "Program " + i);
        }

        mockMvc.perform(withToken(post("/api/programs"), company)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "name", "One too many",
                                "description", "d",
                                "scope", "s",
                                "rewardMin", 1,
                                "rewardMax", 2))))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Too many programs created from this IP, please try again tomorrow."));

        assertThat(programRepository.count()).isEqualTo(5);
    }

    @Test
    void hundredAndFirstGeneralRequest_isRejectedWithHeaders() throws Exception {
        for (int i = 1; i <= 100; i++) {
            mockMvc.perform(get("/api/health").with(fromIp("10.0.0.6")))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(get("/api/health").with(fromIp("10.0.0.6")))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("RateLimit-Limit", "100"))
                .andExpect(header().string("RateLimit-Remaining", "0"))
                .andExpect(header().exists("RateLimit-Reset"))
                .andExpect(jsonPath("$.error").value("Too many requests from this IP, please try again later."))
                .andExpect(jsonPath("$.retryAfter").value("15 minutes"));
    }

    @Test
    void eleventhReportWithinTheHour_isRejected() throws Exception {
        String company = registerAs(User.Role.COMPANY);
        String researcher = registerAs(User.Role.RESEARCHER);
        String programId = createProgram(company, "Busy program");
        for (int i = 1; i <= 10; i++) {
            submitReport(researcher, programId, "Finding " + i);
        }

        mockMvc.perform(withToken(post("/api/reports"), researcher)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("programId", programId, "title", "Finding 11", "description", "d"))))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("RateLimit-Limit", "10"))
                .andExpect(header().string("RateLimit-Remaining", "0"))
                .andExpect(header().exists("RateLimit-Reset"))
                .andExpect(jsonPath("$.error", containsString("Too many reports submitted")))
                .andExpect(jsonPath("$.retryAfter").value("1 hour"));

        assertThat(reportRepository.count()).isEqualTo(10);
    }

    private ResultActions failedLogin(String ip) throws Exception {
        return mockMvc.perform(post("/api/auth/login")
                .with(fromIp(ip))
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("email", "nobody@example.com", "password", "wrong"))));
    }
}
