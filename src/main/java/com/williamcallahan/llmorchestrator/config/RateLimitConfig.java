package com.williamcallahan.llmorchestrator.config;

import com.williamcallahan.llmorchestrator.service.ratelimit.BucketPolicy;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitScope;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token bucket sizing per rate-limit scope.
 */
public class RateLimitConfig {

    private static final int MAX_BUCKETS_DEF = 10_000;
    private static final String MAX_BUCKETS_KEY = "orchestrator.rate-limit.max-buckets";
    private static final String SCOPE_KEY_FMT = "orchestrator.rate-limit.%s";
    private static final String MIN_BUCKETS_FMT = "%s must be at least 2.";
    private static final String POSITIVE_FMT = "%s.%s must be greater than 0.";

    private int maxBuckets = MAX_BUCKETS_DEF;
    private Bucket ip = new Bucket(20, 1.0);
    private Bucket user = new Bucket(60, 1.0);
    private Bucket provider = new Bucket(120, 10.0);
    private Bucket global = new Bucket(600, 50.0);

    /**
     * Validates bucket settings.
     */
    public void validateConfiguration() {
        if (maxBuckets < 2) {
            throw new IllegalStateException(String.format(Locale.ROOT, MIN_BUCKETS_FMT, MAX_BUCKETS_KEY));
        }
        ip.validate("ip");
        user.validate("user");
        provider.validate("provider");
        global.validate("global");
    }

    Map<RateLimitScope, BucketPolicy> policies() {
        Map<RateLimitScope, BucketPolicy> policies = new EnumMap<>(RateLimitScope.class);
        policies.put(RateLimitScope.IP, ip.toPolicy());
        policies.put(RateLimitScope.USER, user.toPolicy());
        policies.put(RateLimitScope.PROVIDER, provider.toPolicy());
        policies.put(RateLimitScope.GLOBAL, global.toPolicy());
        return policies;
    }

    public int getMaxBuckets() {
        return maxBuckets;
    }

    public void setMaxBuckets(final int maxBuckets) {
        this.maxBuckets = maxBuckets;
    }

    public Bucket getIp() {
        return ip;
    }

    public void setIp(final Bucket ip) {
        this.ip = ip;
    }

    public Bucket getUser() {
        return user;
    }

    public void setUser(final Bucket user) {
        this.user = user;
    }

    public Bucket getProvider() {
        return provider;
    }

    public void setProvider(final Bucket provider) {
        this.provider = provider;
    }

    public Bucket getGlobal() {
        return global;
    }

    public void setGlobal(final Bucket global) {
        this.global = global;
    }

    /**
     * Capacity and refill rate of one bucket.
     */
    public static class Bucket {
        private int capacity;
        private double refillPerSecond;

        public Bucket() {}

        Bucket(int capacity, double refillPerSecond) {
            this.capacity = capacity;
            this.refillPerSecond = refillPerSecond;
        }

        void validate(String scopeName) {
            String key = String.format(Locale.ROOT, SCOPE_KEY_FMT, scopeName);
            if (capacity < 1) {
                throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, key, "capacity"));
            }
            if (refillPerSecond <= 0) {
                throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, key, "refill-per-second"));
            }
        }

        BucketPolicy toPolicy() {
            return new BucketPolicy(capacity, refillPerSecond);
        }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public double getRefillPerSecond() { return refillPerSecond; }
        public void setRefillPerSecond(double refillPerSecond) { this.refillPerSecond = refillPerSecond; }
    }
}
