package com.bugbounty.api.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Rate limiting configuration using Bucket4j.
 *
 * One bucket per (policy, client IP). Each bucket refills completely at the
 * end of its window, giving fixed-window counting. Consumption is atomic, so
 * concurrent requests can never overshoot a window's capacity.
 *
 * Buckets live in a Caffeine cache and are dropped once left idle for their
 * policy's window: by then the bucket would have refilled anyway, so a fresh
 * one behaves the same.
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    private final Cache<BucketKey, Bucket> buckets;
    private final RateLimitProperties properties;

    @Autowired
    public RateLimitConfig(RateLimitProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    RateLimitConfig(RateLimitProperties properties, Ticker ticker) {
        this.properties = properties;
        this.buckets = Caffeine.newBuilder()
                .maximumSize(properties.getMaxTrackedClients())
                .expireAfter(new IdleForWindow(properties))
                .ticker(ticker)
                .build();
    }

    public Bucket resolveBucket(RateLimitPolicy policy, String clientIp) {
        return buckets.get(new BucketKey(policy, clientIp), key -> createBucket(key.policy()));
    }

    public int capacityOf(RateLimitPolicy policy) {
        return properties.capacityOf(policy);
    }

    /**
     * Number of (policy, client) buckets currently held.
     */
    long trackedBuckets() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private Bucket createBucket(RateLimitPolicy policy) {
        int capacity = properties.capacityOf(policy);
        Bandwidth limit = Bandwidth.classic(capacity, Refill.intervally(capacity, properties.windowOf(policy)));
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Clears every bucket, resetting all windows.
     */
    public void clearBuckets() {
        buckets.invalidateAll();
    }

    record BucketKey(RateLimitPolicy policy, String clientIp) {}

    private static final class IdleForWindow implements Expiry<BucketKey, Bucket> {

        private final RateLimitProperties properties;

        IdleForWindow(RateLimitProperties properties) {
            this.properties = properties;
        }

        @Override
        public long expireAfterCreate(BucketKey key, Bucket bucket, long currentTime) {
            return properties.windowOf(key.policy()).toNanos();
        }

        @Override
        public long expireAfterUpdate(BucketKey key, Bucket bucket, long currentTime, long currentDuration) {
            return properties.windowOf(key.policy()).toNanos();
        }

        @Override
        public long expireAfterRead(BucketKey key, Bucket bucket, long currentTime, long currentDuration) {
            return properties.windowOf(key.policy()).toNanos();
        }
    }
}
