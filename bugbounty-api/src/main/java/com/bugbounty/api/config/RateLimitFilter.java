package com.bugbounty.api.config;

import com.bugbounty.api.error.ErrorResponseWriter;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Per-IP admission control. Runs ahead of authentication so rejected and
 * unauthenticated attempts are counted too.
 *
 * Every limited response carries {@code RateLimit-Limit},
 * {@code RateLimit-Remaining} and {@code RateLimit-Reset}. Requests over the
 * limit get 429 with {@code {error, retryAfter}}.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String HEADER_LIMIT = "RateLimit-Limit";
    static final String HEADER_REMAINING = "RateLimit-Remaining";
    static final String HEADER_RESET = "RateLimit-Reset";

    private final RateLimitConfig rateLimitConfig;
    private final RateLimitProperties properties;
    private final ErrorResponseWriter errorWriter;

    public RateLimitFilter(RateLimitConfig rateLimitConfig, RateLimitProperties properties,
                           ErrorResponseWriter errorWriter) {
        this.rateLimitConfig = rateLimitConfig;
        this.properties = properties;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !properties.isEnabled() || selectPolicy(request) == null;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        RateLimitPolicy policy = selectPolicy(request);
        String clientIp = resolveClientIp(request);
        Bucket bucket = rateLimitConfig.resolveBucket(policy, clientIp);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        response.setHeader(HEADER_LIMIT, String.valueOf(rateLimitConfig.capacityOf(policy)));
        response.setHeader(HEADER_REMAINING, String.valueOf(probe.getRemainingTokens()));
        response.setHeader(HEADER_RESET, String.valueOf(toSeconds(probe.getNanosToWaitForReset())));

        if (!probe.isConsumed()) {
            log.warn("Rate limit {} exceeded for {}", policy, clientIp);
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(toSeconds(probe.getNanosToWaitForRefill())));
            errorWriter.writeBody(response, HttpStatus.TOO_MANY_REQUESTS.value(),
                    new RateLimitExceededResponse(policy.message(), policy.retryAfter()));
            return;
        }

        chain.doFilter(request, response);

        if (policy.skipSuccessfulRequests() && response.getStatus() < HttpStatus.BAD_REQUEST.value()) {
            bucket.addTokens(1);
        }
    }

    private RateLimitPolicy selectPolicy(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return RateLimitPolicy.forRequest(request.getMethod(), path);
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (properties.isTrustForwardedFor()) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }

    private static long toSeconds(long nanos) {
        return (nanos + TimeUnit.SECONDS.toNanos(1) - 1) / TimeUnit.SECONDS.toNanos(1);
    }

    public record RateLimitExceededResponse(String error, String retryAfter) {}
}
