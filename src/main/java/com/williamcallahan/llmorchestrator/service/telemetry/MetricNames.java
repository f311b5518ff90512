package com.williamcallahan.llmorchestrator.service.telemetry;

/**
 * Metric names and tag keys emitted by the orchestration core.
 */
public final class MetricNames {
    public static final String CACHE_LOOKUP = "orchestrator.cache.lookup";
    public static final String PROVIDER_LATENCY = "orchestrator.provider.latency";
    public static final String PROVIDER_CALL = "orchestrator.provider.call";
    public static final String BREAKER_TRANSITION = "orchestrator.breaker.transition";
    public static final String BREAKER_STATE = "orchestrator.breaker.state";
    public static final String BUDGET_REMAINING = "orchestrator.budget.remaining";
    public static final String BUDGET_WARNING = "orchestrator.budget.warning";
    public static final String BUDGET_OVERRUN = "orchestrator.budget.overrun";
    public static final String RATE_LIMITED = "orchestrator.ratelimit.denied";
    public static final String REQUEST_OUTCOME = "orchestrator.request.outcome";
    public static final String COALESCED = "orchestrator.coalesced";
    public static final String USAGE_DROPPED = "orchestrator.usage.dropped";

    public static final String TAG_PROVIDER = "provider";
    public static final String TAG_PERIOD = "period";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_STATE = "state";
    public static final String TAG_SCOPE = "scope";

    private MetricNames() {}
}
