package com.williamcallahan.llmorchestrator.service.ratelimit;

import java.time.Duration;

/**
 * Continuously refilling token bucket for one scope key.
 *
 * <p>Each bucket is its own lock; refill and consumption for one key never contend with
 * other keys.</p>
 */
final class TokenBucket {
    private static final long MILLIS_PER_SECOND = 1000L;

    private final String scopeKey;
    private final BucketPolicy policy;
    private double tokens;
    private long lastRefillAtMillis;
    private volatile long lastAccessAtMillis;

    TokenBucket(String scopeKey, BucketPolicy policy, long nowMillis) {
        this.scopeKey = scopeKey;
        this.policy = policy;
        this.tokens = policy.capacity();
        this.lastRefillAtMillis = nowMillis;
        this.lastAccessAtMillis = nowMillis;
    }

    /**
     * Consumes one token when available.
     *
     * @return zero when a token was consumed, otherwise the time until one becomes available
     */
    synchronized Duration tryConsume(long nowMillis) {
        refill(nowMillis);
        lastAccessAtMillis = nowMillis;
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return Duration.ZERO;
        }
        double missing = 1.0 - tokens;
        long waitMillis = (long) Math.ceil(missing * MILLIS_PER_SECOND / policy.refillPerSecond());
        return Duration.ofMillis(Math.max(1L, waitMillis));
    }

    /** Returns one previously consumed token, never exceeding capacity. */
    synchronized void refund(long nowMillis) {
        refill(nowMillis);
        tokens = Math.min(policy.capacity(), tokens + 1.0);
    }

    synchronized double availableTokens(long nowMillis) {
        refill(nowMillis);
        return tokens;
    }

    long lastAccessAtMillis() {
        return lastAccessAtMillis;
    }

    String scopeKey() {
        return scopeKey;
    }

    private void refill(long nowMillis) {
        long elapsedMillis = nowMillis - lastRefillAtMillis;
        if (elapsedMillis <= 0) {
            return;
        }
        tokens = Math.min(policy.capacity(), tokens + elapsedMillis * policy.refillPerSecond() / MILLIS_PER_SECOND);
        lastRefillAtMillis = nowMillis;
    }
}
