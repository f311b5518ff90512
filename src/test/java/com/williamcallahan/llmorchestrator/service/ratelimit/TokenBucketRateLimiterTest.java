package com.williamcallahan.llmorchestrator.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import com.williamcallahan.llmorchestrator.support.MutableClock;
import com.williamcallahan.llmorchestrator.support.RecordingMetricsSink;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies token-bucket refill, denial hints, ordered multi-scope checks and bucket eviction.
 */
class TokenBucketRateLimiterTest {

    private static final String USER_KEY = "user:123";
    private static final String IP_KEY = "ip:10.0.0.1";
    private static final String GLOBAL_KEY = "global";
    private static final BucketPolicy TEN_PER_TEN_SECONDS = new BucketPolicy(10, 1.0);
    private static final BucketPolicy GENEROUS = new BucketPolicy(1000, 1000.0);

    private MutableClock clock;
    private RecordingMetricsSink metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-15T12:00:00Z");
        metrics = new RecordingMetricsSink();
    }

    @Test
    void allow_tenImmediateCallsSucceedAndEleventhWaitsAboutOneSecond() {
        TokenBucketRateLimiter limiter = limiter(Map.of(RateLimitScope.USER, TEN_PER_TEN_SECONDS), 100);

        for (int call = 0; call < 10; call++) {
            assertTrue(limiter.allow(USER_KEY).allowed(), "call " + call + " should be allowed");
        }
        RateLimitDecision denied = limiter.allow(USER_KEY);

        assertFalse(denied.allowed());
        assertEquals(USER_KEY, denied.scopeKey());
        assertEquals(Duration.ofSeconds(1), denied.retryAfter());
        assertEquals(1, metrics.count(MetricNames.RATE_LIMITED));
        assertEquals("user", metrics.named(MetricNames.RATE_LIMITED).get(0).tags().get(MetricNames.TAG_SCOPE));
    }

    @Test
    void refund_returnsTokenWithoutExceedingCapacity() {
        TokenBucketRateLimiter limiter = limiter(Map.of(RateLimitScope.USER, TEN_PER_TEN_SECONDS), 100);
        limiter.allow(USER_KEY);
        limiter.allow(USER_KEY);

        limiter.refund(USER_KEY);
        assertEquals(9.0, limiter.availableTokens(USER_KEY), 1e-9);

        limiter.refund(USER_KEY);
        limiter.refund(USER_KEY);
        assertEquals(10.0, limiter.availableTokens(USER_KEY), 1e-9);

        limiter.refund(IP_KEY);
        assertFalse(limiter.isTracked(IP_KEY));
    }

    @Test
    void allow_refillsWithElapsedTime() {
        TokenBucketRateLimiter limiter = limiter(Map.of(RateLimitScope.USER, TEN_PER_TEN_SECONDS), 100);
        for (int call = 0; call < 10; call++) {
            limiter.allow(USER_KEY);
        }

        clock.advance(Duration.ofMillis(400));
        RateLimitDecision stillDenied = limiter.allow(USER_KEY);
        clock.advance(Duration.ofMillis(600));
        RateLimitDecision refilled = limiter.allow(USER_KEY);

        assertFalse(stillDenied.allowed());
        assertEquals(600, stillDenied.retryAfter().toMillis(), 1);
        assertTrue(refilled.allowed());
    }

    @Test
    void allow_neverRefillsBeyondCapacity() {
        TokenBucketRateLimiter limiter = limiter(Map.of(RateLimitScope.USER, TEN_PER_TEN_SECONDS), 100);
        limiter.allow(USER_KEY);

        clock.advance(Duration.ofHours(1));

        assertEquals(10.0, limiter.availableTokens(USER_KEY), 1e-9);
    }

    @Test
    void allow_rejectsBlankKey() {
        TokenBucketRateLimiter limiter = limiter(Map.of(), 100);

        assertThrows(IllegalArgumentException.class, () -> limiter.allow(" "));
    }

    @Test
    void availableTokens_reportsPolicyCapacityForUntrackedKey() {
        TokenBucketRateLimiter limiter = limiter(Map.of(RateLimitScope.USER, TEN_PER_TEN_SECONDS), 100);

        assertEquals(10.0, limiter.availableTokens(USER_KEY), 1e-9);
        assertEquals(1000.0, limiter.availableTokens("tenant:acme"), 1e-9);
        assertEquals(0, limiter.bucketCount());
    }

    @Test
    void allowAll_checksIpBeforeUserAndStopsAtFirstDenial() {
        BucketPolicy single = new BucketPolicy(1, 0.001);
        TokenBucketRateLimiter limiter = limiter(Map.of(RateLimitScope.IP, single), 100);
        limiter.allow(IP_KEY);

        RateLimitDecision decision = limiter.allowAll(List.of(GLOBAL_KEY, USER_KEY, IP_KEY));

        assertFalse(decision.allowed());
        assertEquals(IP_KEY, decision.scopeKey());
        assertFalse(limiter.isTracked(USER_KEY));
        assertFalse(limiter.isTracked(GLOBAL_KEY));
    }

    @Test
    void allowAll_consumesFromEveryScopeWhenAllowed() {
        TokenBucketRateLimiter limiter = limiter(Map.of(RateLimitScope.USER, TEN_PER_TEN_SECONDS), 100);

        RateLimitDecision decision = limiter.allowAll(List.of(GLOBAL_KEY, USER_KEY));

        assertTrue(decision.allowed());
        assertEquals(GLOBAL_KEY, decision.scopeKey());
        assertEquals(9.0, limiter.availableTokens(USER_KEY), 1e-9);
        assertEquals(999.0, limiter.availableTokens(GLOBAL_KEY), 1e-9);
    }

    @Test
    void allowAll_checksUnknownPrefixesLast() {
        BucketPolicy single = new BucketPolicy(1, 0.001);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(
                Map.of(RateLimitScope.GLOBAL, single), single, 100, clock, metrics);
        limiter.allow(GLOBAL_KEY);

        RateLimitDecision decision = limiter.allowAll(List.of("tenant:acme", GLOBAL_KEY));

        assertFalse(decision.allowed());
        assertEquals(GLOBAL_KEY, decision.scopeKey());
        assertFalse(limiter.isTracked("tenant:acme"));
    }

    @Test
    void allow_evictsLeastRecentlyUsedBucketButKeepsGlobal() {
        TokenBucketRateLimiter limiter = limiter(Map.of(), 3);
        limiter.allow(GLOBAL_KEY);
        clock.advance(Duration.ofMillis(10));
        limiter.allow("user:first");
        clock.advance(Duration.ofMillis(10));
        limiter.allow("user:second");
        clock.advance(Duration.ofMillis(10));

        limiter.allow("user:third");

        assertEquals(3, limiter.bucketCount());
        assertTrue(limiter.isTracked(GLOBAL_KEY));
        assertFalse(limiter.isTracked("user:first"));
        assertTrue(limiter.isTracked("user:second"));
        assertTrue(limiter.isTracked("user:third"));
    }

    @Test
    void constructor_rejectsTooSmallBucketCeiling() {
        assertThrows(IllegalArgumentException.class, () -> limiter(Map.of(), 1));
    }

    @Test
    void allow_concurrentCallersNeverExceedCapacity() throws Exception {
        int capacity = 50;
        TokenBucketRateLimiter limiter = limiter(
                Map.of(RateLimitScope.USER, new BucketPolicy(capacity, 0.001)), 100);
        int callers = 8;
        int callsPerCaller = 25;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int caller = 0; caller < callers; caller++) {
                results.add(pool.submit(() -> {
                    start.await();
                    int allowed = 0;
                    for (int call = 0; call < callsPerCaller; call++) {
                        if (limiter.allow(USER_KEY).allowed()) {
                            allowed++;
                        }
                    }
                    return allowed;
                }));
            }
            start.countDown();
            int totalAllowed = 0;
            for (Future<Integer> result : results) {
                totalAllowed += result.get(10, TimeUnit.SECONDS);
            }

            assertEquals(capacity, totalAllowed);
            assertEquals(1, limiter.bucketCount());
        } finally {
            pool.shutdownNow();
        }
    }

    private TokenBucketRateLimiter limiter(Map<RateLimitScope, BucketPolicy> policies, int maxBuckets) {
        return new TokenBucketRateLimiter(policies, GENEROUS, maxBuckets, clock, metrics);
    }
}
