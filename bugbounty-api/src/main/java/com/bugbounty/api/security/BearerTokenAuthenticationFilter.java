package com.bugbounty.api.security;

import com.bugbounty.api.auth.JwtTokenService;
import com.bugbounty.api.error.ErrorResponseWriter;
import com.bugbounty.core.domain.User;
import com.bugbounty.core.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.context.SecurityContextHolderStrategy;
import org.springframework.transaction.TransactionException;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves the acting user from an {@code Authorization: Bearer <token>} header.
 *
 * On success the freshly loaded {@link User} is placed in the security context.
 * On failure the request continues anonymously and the reason is left in the
 * {@link #FAILURE_ATTRIBUTE} request attribute; public routes are unaffected and
 * protected routes are rejected by {@link JsonAuthenticationEntryPoint} with
 * that reason. The user is re-read on every request so tokens of deleted users
 * stop working immediately. If that lookup itself fails the request ends here
 * with a 500 envelope.
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    public static final String FAILURE_ATTRIBUTE = BearerTokenAuthenticationFilter.class.getName() + ".FAILURE";

    static final String INVALID_TOKEN = "Invalid token";
    static final String USER_NOT_FOUND = "User not found";
    static final String LOOKUP_FAILED = "Internal Server Error";

    private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "bearer";

    private final JwtTokenService jwtTokenService;
    private final UserRepository userRepository;
    private final ErrorResponseWriter errorWriter;
    private final SecurityContextHolderStrategy contextHolderStrategy =
            SecurityContextHolder.getContextHolderStrategy();

    public BearerTokenAuthenticationFilter(JwtTokenService jwtTokenService, UserRepository userRepository,
                                           ErrorResponseWriter errorWriter) {
        this.jwtTokenService = jwtTokenService;
        this.userRepository = userRepository;
        this.errorWriter = errorWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        Optional<String> token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isPresent()) {
            try {
                authenticate(token.get(), request);
            } catch (DataAccessException | TransactionException e) {
                log.error("User lookup failed while authenticating request", e);
                errorWriter.write(response, HttpStatus.INTERNAL_SERVER_ERROR.value(), LOOKUP_FAILED);
                return;
            }
        }
        chain.doFilter(request, response);
    }

    private void authenticate(String token, HttpServletRequest request) {
        JwtTokenService.TokenClaims claims;
        try {
            claims = jwtTokenService.verify(token);
        } catch (JwtTokenService.InvalidTokenException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            request.setAttribute(FAILURE_ATTRIBUTE, INVALID_TOKEN);
            return;
        }

        Optional<User> user = userRepository.findById(claims.userId());
        if (user.isEmpty()) {
            log.warn("Token presented for unknown user {}", claims.userId());
            request.setAttribute(FAILURE_ATTRIBUTE, USER_NOT_FOUND);
            return;
        }

        SecurityContext context = contextHolderStrategy.createEmptyContext();
        context.setAuthentication(new ActorAuthenticationToken(user.get(), token));
        contextHolderStrategy.setContext(context);
    }

    /**
     * Extracts the token from an Authorization header value of the form
     * {@code "Bearer <token>"}. The scheme is matched case-insensitively.
     */
    static Optional<String> extractToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= BEARER_PREFIX.length()
                || !trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                || !Character.isWhitespace(trimmed.charAt(BEARER_PREFIX.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER_PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
