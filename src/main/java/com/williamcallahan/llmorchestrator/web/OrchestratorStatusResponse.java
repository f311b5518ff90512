package com.williamcallahan.llmorchestrator.web;

import com.williamcallahan.llmorchestrator.service.cache.CacheStats;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerSnapshot;
import com.williamcallahan.llmorchestrator.service.cost.BudgetSnapshot;
import java.util.List;

/**
 * Point-in-time diagnostics of the orchestration core.
 *
 * @param providers registered provider names in configuration order
 * @param circuits breaker state per provider
 * @param budgets daily and monthly windows per provider
 * @param cache response cache counters
 * @param rateLimitBuckets live token buckets
 * @param coalescedWaiters callers that shared another request's result
 * @param unbilledOverrunCents cost above estimates that could not be billed within limits
 * @param usageRecordsWritten usage records persisted
 * @param usageRecordsDropped usage records dropped because the queue was full
 */
public record OrchestratorStatusResponse(
        List<String> providers,
        List<CircuitBreakerSnapshot> circuits,
        List<BudgetSnapshot> budgets,
        CacheStats cache,
        int rateLimitBuckets,
        long coalescedWaiters,
        long unbilledOverrunCents,
        long usageRecordsWritten,
        long usageRecordsDropped) {}
