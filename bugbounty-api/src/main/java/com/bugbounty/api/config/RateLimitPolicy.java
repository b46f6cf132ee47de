package com.bugbounty.api.config;

import org.springframework.http.HttpMethod;

import java.time.Duration;

/**
 * Request classes with their own per-IP admission window.
 */
public enum RateLimitPolicy {

    GENERAL(100, Duration.ofMinutes(15),
            "Too many requests from this IP, please try again later.", "15 minutes", false),

    /** Counts failed attempts only; successful logins and registrations are refunded. */
    AUTHENTICATION(5, Duration.ofMinutes(15),
            "Too many authentication attempts from this IP, please try again later.", "15 minutes", true),

    REPORT_CREATION(10, Duration.ofHours(1),
            "Too many reports submitted from this IP, please try again later.", "1 hour", false),

    PROGRAM_CREATION(5, Duration.ofHours(24),
            "Too many programs created from this IP, please try again tomorrow.", "24 hours", false);

    private final int defaultCapacity;
    private final Duration defaultWindow;
    private final String message;
    private final String retryAfter;
    private final boolean skipSuccessfulRequests;

    RateLimitPolicy(int defaultCapacity, Duration defaultWindow, String message,
                    String retryAfter, boolean skipSuccessfulRequests) {
        this.defaultCapacity = defaultCapacity;
        this.defaultWindow = defaultWindow;
        this.message = message;
        this.retryAfter = retryAfter;
        this.skipSuccessfulRequests = skipSuccessfulRequests;
    }

    public int defaultCapacity() { return defaultCapacity; }
    public Duration defaultWindow() { return defaultWindow; }
    public String message() { return message; }
    public String retryAfter() { return retryAfter; }
    public boolean skipSuccessfulRequests() { return skipSuccessfulRequests; }

    /**
     * Selects the policy for a request path relative to the context path.
     * Returns null for paths outside the API.
     */
    public static RateLimitPolicy forRequest(String method, String path) {
        if (path == null || !(path.equals("/api") || path.startsWith("/api/"))) {
            return null;
        }
        if (HttpMethod.POST.matches(method)) {
            switch (path) {
                case "/api/auth/register":
                case "/api/auth/login":
                    return AUTHENTICATION;
                case "/api/reports":
                    return REPORT_CREATION;
                case "/api/programs":
                    return PROGRAM_CREATION;
                default:
                    break;
            }
        }
        return GENERAL;
    }
}
