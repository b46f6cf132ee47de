package com.bugbounty.api.auth;

import com.bugbounty.core.domain.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * JWT Token Service.
 * Issues HMAC-SHA signed bearer tokens carrying the user's id and email,
 * valid for one hour by default.
 *
 * Verification checks signature and expiry only. Whether the user still
 * exists is the caller's concern.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_ID = "id";
    static final String CLAIM_EMAIL = "email";

    private final SecretKey signingKey;
    private final long tokenValiditySeconds;

    public JwtTokenService(
            @Value("${bugbounty.jwt.secret}") String jwtSecret,
            @Value("${bugbounty.jwt.token-validity:3600}") long tokenValiditySeconds) {

        if (jwtSecret == null || jwtSecret.length() < 32) {
            throw new IllegalArgumentException("JWT secret must be at least 32 characters");
        }

        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.tokenValiditySeconds = tokenValiditySeconds;
    }

    /**
     * Issues a token for the given user.
     */
    public IssuedToken issue(User user) {
        Instant now = Instant.now();
        Instant expiry = now.plusSeconds(tokenValiditySeconds);

        String token = Jwts.builder()
                .subject(user.getId().toString())
                .claim(CLAIM_ID, user.getId().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(signingKey)
                .compact();

        return new IssuedToken(token, expiry);
    }

    /**
     * Validates and parses a token.
     * Returns claims if valid, throws {@link InvalidTokenException} otherwise.
     */
    public TokenClaims verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String id = claims.get(CLAIM_ID, String.class);
            if (id == null) {
                throw new JwtException("Missing id claim");
            }

            return new TokenClaims(
                    UUID.fromString(id),
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.getExpiration().toInstant()
            );
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
    }

    public record IssuedToken(
            String token,
            Instant expiresAt
    ) {}

    public record TokenClaims(
            UUID userId,
            String email,
            Instant expiry
    ) {}

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class TokenExpiredException extends InvalidTokenException {
        public TokenExpiredException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
