package com.bugbounty.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rate limiting settings, bound from {@code bugbounty.rate-limit.*}.
 *
 * <pre>
 * bugbounty:
 *   rate-limit:
 *     enabled: true
 *     trust-forwarded-for: false
 *     max-tracked-clients: 100000
 *     limits:
 *       authentication:
 *         capacity: 5
 *         window: 15m
 * </pre>
 *
 * Policies without an entry under {@code limits} use their built-in defaults.
 */
@ConfigurationProperties(prefix = "bugbounty.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private boolean trustForwardedFor = false;
    private long maxTrackedClients = 100_000;
    private Map<RateLimitPolicy, Limit> limits = new EnumMap<>(RateLimitPolicy.class);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean isTrustForwardedFor() { return trustForwardedFor; }
    public void setTrustForwardedFor(boolean trustForwardedFor) { this.trustForwardedFor = trustForwardedFor; }
    public long getMaxTrackedClients() { return maxTrackedClients; }
    public void setMaxTrackedClients(long maxTrackedClients) { this.maxTrackedClients = maxTrackedClients; }
    public Map<RateLimitPolicy, Limit> getLimits() { return limits; }
    public void setLimits(Map<RateLimitPolicy, Limit> limits) { this.limits = limits; }

    public int capacityOf(RateLimitPolicy policy) {
        Limit limit = limits.get(policy);
        return limit != null && limit.getCapacity() != null ? limit.getCapacity() : policy.defaultCapacity();
    }

    public Duration windowOf(RateLimitPolicy policy) {
        Limit limit = limits.get(policy);
        return limit != null && limit.getWindow() != null ? limit.getWindow() : policy.defaultWindow();
    }

    public static class Limit {

        private Integer capacity;
        private Duration window;

        public Integer getCapacity() { return capacity; }
        public void setCapacity(Integer capacity) { this.capacity = capacity; }
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }
}
