package com.williamcallahan.llmorchestrator.service.ratelimit;

import java.time.Duration;

/**
 * Outcome of a rate-limit check.
 *
 * @param allowed whether the call may proceed
 * @param retryAfter suggested delay before retrying, zero when allowed
 * @param scopeKey bucket that decided; for multi-scope checks, the first denying bucket
 */
public record RateLimitDecision(boolean allowed, Duration retryAfter, String scopeKey) {
    public RateLimitDecision {
        retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
        scopeKey = scopeKey == null ? "" : scopeKey;
    }

    static RateLimitDecision allow(String scopeKey) {
        return new RateLimitDecision(true, Duration.ZERO, scopeKey);
    }

    static RateLimitDecision deny(String scopeKey, Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter, scopeKey);
    }
}
