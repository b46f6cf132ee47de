package com.bugbounty.api.security;

import com.bugbounty.api.auth.JwtTokenService;
import com.bugbounty.api.error.ErrorResponseWriter;
import com.bugbounty.core.domain.User;
import com.bugbounty.core.repository.UserRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BearerTokenAuthenticationFilterTest {

    private static final String SECRET = "filter-test-secret-with-at-least-32-characters";

    private final JwtTokenService jwtTokenService = new JwtTokenService(SECRET, 3600);
    private final UserRepository userRepository = mock(UserRepository.class);
    private final BearerTokenAuthenticationFilter filter = new BearerTokenAuthenticationFilter(
            jwtTokenService, userRepository, new ErrorResponseWriter(new ObjectMapper()));

    private final User user = User.register("dana@example.com", "Dana", "hash", User.Role.RESEARCHER);

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void extractsTokenFromBearerHeader() {
        assertThat(BearerTokenAuthenticationFilter.extractToken("Bearer abc.def.ghi")).contains("abc.def.ghi");
    }

    @Test
    void schemeIsCaseInsensitive() {
        assertThat(BearerTokenAuthenticationFilter.extractToken("bearer abc")).contains("abc");
        assertThat(BearerTokenAuthenticationFilter.extractToken("BEARER abc")).contains("abc");
    }

    @Test
    void missingOrForeignSchemeYieldsNothing() {
        assertThat(BearerTokenAuthenticationFilter.extractToken(null)).isEmpty();
        assertThat(BearerTokenAuthenticationFilter.extractToken("")).isEmpty();
        assertThat(BearerTokenAuthenticationFilter.extractToken("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(BearerTokenAuthenticationFilter.extractToken("Bearer")).isEmpty();
        assertThat(BearerTokenAuthenticationFilter.extractToken("Bearer    ")).isEmpty();
        assertThat(BearerTokenAuthenticationFilter.extractToken("Bearerabc")).isEmpty();
    }

    @Test
    void knownUserIsPlacedInSecurityContext() throws Exception {
        when(userRepository.findById(any())).thenReturn(Optional.of(user));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(requestWithToken(), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication().getPrincipal()).isSameAs(user);
    }

    @Test
    void failedUserLookupEndsRequestWithErrorEnvelope() throws Exception {
        when(userRepository.findById(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(requestWithToken(), response, chain);

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getContentAsString())
                .contains("\"status\":500")
                .contains("\"error\":\"Internal Server Error\"")
                .doesNotContain("connection refused");
        assertThat(chain.getRequest()).isNull();
    }

    private MockHttpServletRequest requestWithToken() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/me");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + jwtTokenService.issue(user).token());
        return request;
    }
}
