package com.williamcallahan.llmorchestrator.service.ratelimit;

import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricsSink;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-scope token-bucket limiter.
 *
 * <p>Buckets are created lazily, exactly once per key, under a creation lock. To bound memory
 * when unauthenticated callers present many distinct keys, creating a bucket beyond
 * {@code maxBuckets} first evicts the least recently used bucket; the global bucket is never
 * evicted. Checks never block waiting for tokens: a denied caller receives a retry hint.</p>
 */
public class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private static final Comparator<RateLimitScope> CHECK_ORDER = Comparator.comparingInt(Enum::ordinal);

    private final ConcurrentMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Map<RateLimitScope, BucketPolicy> policies;
    private final BucketPolicy defaultPolicy;
    private final int maxBuckets;
    private final Clock clock;
    private final MetricsSink metricsSink;
    private final Object creationLock = new Object();

    /**
     * Creates a limiter.
     *
     * @param policies per-scope bucket policies; scopes without a policy use {@code defaultPolicy}
     * @param defaultPolicy policy for unknown scopes and unconfigured scope types
     * @param maxBuckets live-bucket ceiling triggering LRU eviction
     * @param clock time source for refills
     * @param metricsSink receiver for denial counts
     */
    public TokenBucketRateLimiter(
            Map<RateLimitScope, BucketPolicy> policies,
            BucketPolicy defaultPolicy,
            int maxBuckets,
            Clock clock,
            MetricsSink metricsSink) {
        if (maxBuckets < 2) {
            throw new IllegalArgumentException("maxBuckets must be at least 2");
        }
        this.policies = policies.isEmpty() ? new EnumMap<>(RateLimitScope.class) : new EnumMap<>(policies);
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        this.maxBuckets = maxBuckets;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink");
    }

    /**
     * Consumes one token from the bucket for {@code scopeKey}.
     *
     * @param scopeKey bucket key such as {@code user:123}, {@code provider:openai} or {@code global}
     * @return allowed, or denied with the delay until a token is available
     */
    public RateLimitDecision allow(String scopeKey) {
        if (scopeKey == null || scopeKey.isBlank()) {
            throw new IllegalArgumentException("scopeKey cannot be null or blank");
        }
        long nowMillis = clock.millis();
        Duration retryAfter = bucketFor(scopeKey, nowMillis).tryConsume(nowMillis);
        if (retryAfter.isZero()) {
            return RateLimitDecision.allow(scopeKey);
        }
        String scopeTag = RateLimitScope.fromKey(scopeKey)
                .map(scope -> scope.name().toLowerCase(Locale.ROOT))
                .orElse("other");
        metricsSink.emit(MetricNames.RATE_LIMITED, 1, Map.of(MetricNames.TAG_SCOPE, scopeTag));
        log.debug("Rate limit denied (scope={}, retryAfterMs={})", scopeTag, retryAfter.toMillis());
        return RateLimitDecision.deny(scopeKey, retryAfter);
    }

    /**
     * Checks several scope keys in the fixed order IP, user, provider, global, stopping at the
     * first denial. Keys with unknown prefixes are checked last, in the order given. Tokens
     * already consumed by earlier scopes are not refunded.
     *
     * @param scopeKeys bucket keys to check
     * @return the first denial, or an allow decision naming the last key checked
     */
    public RateLimitDecision allowAll(List<String> scopeKeys) {
        List<String> ordered = scopeKeys.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(
                        (String key) -> RateLimitScope.fromKey(key).orElse(null),
                        Comparator.nullsLast(CHECK_ORDER)))
                .toList();
        RateLimitDecision last = RateLimitDecision.allow("");
        for (String scopeKey : ordered) {
            last = allow(scopeKey);
            if (!last.allowed()) {
                return last;
            }
        }
        return last;
    }

    /**
     * Gives back a token consumed by {@link #allow} for work that was never performed. A key whose
     * bucket was evicted in the meantime is ignored; a new bucket starts full anyway.
     *
     * @param scopeKey bucket key that granted the token
     */
    public void refund(String scopeKey) {
        TokenBucket bucket = buckets.get(scopeKey);
        if (bucket != null) {
            bucket.refund(clock.millis());
        }
    }

    /** Number of live buckets. */
    public int bucketCount() {
        return buckets.size();
    }

    /** Tokens currently available for a key; an untracked key reports its full capacity. */
    public double availableTokens(String scopeKey) {
        TokenBucket bucket = buckets.get(scopeKey);
        if (bucket == null) {
            return policyFor(scopeKey).capacity();
        }
        return bucket.availableTokens(clock.millis());
    }

    boolean isTracked(String scopeKey) {
        return buckets.containsKey(scopeKey);
    }

    private TokenBucket bucketFor(String scopeKey, long nowMillis) {
        TokenBucket existing = buckets.get(scopeKey);
        if (existing != null) {
            return existing;
        }
        synchronized (creationLock) {
            existing = buckets.get(scopeKey);
            if (existing != null) {
                return existing;
            }
            if (buckets.size() >= maxBuckets) {
                evictLeastRecentlyUsed();
            }
            TokenBucket created = new TokenBucket(scopeKey, policyFor(scopeKey), nowMillis);
            buckets.put(scopeKey, created);
            return created;
        }
    }

    private void evictLeastRecentlyUsed() {
        String globalKey = RateLimitScope.GLOBAL.key(null);
        buckets.values().stream()
                .filter(bucket -> !globalKey.equals(bucket.scopeKey()))
                .min(Comparator.comparingLong(TokenBucket::lastAccessAtMillis))
                .ifPresent(victim -> {
                    buckets.remove(victim.scopeKey(), victim);
                    log.debug("Evicted idle rate-limit bucket (liveBuckets={})", buckets.size());
                });
    }

    private BucketPolicy policyFor(String scopeKey) {
        return RateLimitScope.fromKey(scopeKey).map(policies::get).orElse(defaultPolicy);
    }
}
