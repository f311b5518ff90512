package com.williamcallahan.llmorchestrator.service;

import com.williamcallahan.llmorchestrator.service.cache.CachedCompletionCodec;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCache;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerRegistry;
import com.williamcallahan.llmorchestrator.service.cost.CostLedger;
import com.williamcallahan.llmorchestrator.service.history.AttemptHistory;
import com.williamcallahan.llmorchestrator.service.ratelimit.TokenBucketRateLimiter;
import com.williamcallahan.llmorchestrator.service.routing.LatencyTracker;
import com.williamcallahan.llmorchestrator.service.routing.ProviderConcurrencyLimiter;
import com.williamcallahan.llmorchestrator.service.routing.ProviderRouter;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricsSink;
import com.williamcallahan.llmorchestrator.service.telemetry.UsageSink;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Shared mutable collaborators of one orchestrator instance.
 *
 * <p>Everything with process-wide state (budgets, breakers, buckets, cache) is passed in here
 * rather than reached through statics, so each test can build an isolated set.</p>
 *
 * @param rateLimiter multi-scope token buckets
 * @param costLedger provider budgets
 * @param responseCache completed responses
 * @param cacheCodec payload codec for the response cache
 * @param breakers per-provider circuit breakers
 * @param router candidate ordering
 * @param concurrencyLimiter per-provider in-flight slots
 * @param latencyTracker observed provider latency
 * @param usageSink audit and billing records
 * @param metricsSink measurements
 * @param attemptHistory recent provider attempts
 * @param clock time source
 * @param providerExecutor runs blocking provider calls so they can be abandoned at the deadline
 * @param requestExecutor runs batch members concurrently
 */
public record OrchestrationContext(
        TokenBucketRateLimiter rateLimiter,
        CostLedger costLedger,
        ResponseCache responseCache,
        CachedCompletionCodec cacheCodec,
        CircuitBreakerRegistry breakers,
        ProviderRouter router,
        ProviderConcurrencyLimiter concurrencyLimiter,
        LatencyTracker latencyTracker,
        UsageSink usageSink,
        MetricsSink metricsSink,
        AttemptHistory attemptHistory,
        Clock clock,
        ExecutorService providerExecutor,
        ExecutorService requestExecutor) {

    public OrchestrationContext {
        Objects.requireNonNull(rateLimiter, "rateLimiter");
        Objects.requireNonNull(costLedger, "costLedger");
        Objects.requireNonNull(responseCache, "responseCache");
        Objects.requireNonNull(cacheCodec, "cacheCodec");
        Objects.requireNonNull(breakers, "breakers");
        Objects.requireNonNull(router, "router");
        Objects.requireNonNull(concurrencyLimiter, "concurrencyLimiter");
        Objects.requireNonNull(latencyTracker, "latencyTracker");
        Objects.requireNonNull(usageSink, "usageSink");
        Objects.requireNonNull(metricsSink, "metricsSink");
        Objects.requireNonNull(attemptHistory, "attemptHistory");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(providerExecutor, "providerExecutor");
        Objects.requireNonNull(requestExecutor, "requestExecutor");
    }
}
