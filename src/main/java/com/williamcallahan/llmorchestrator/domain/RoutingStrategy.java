package com.williamcallahan.llmorchestrator.domain;

/**
 * How the router trades provider quality against cost and latency when ranking candidates.
 *
 * <p>Every strategy still honors breaker state, concurrency and budget pressure; only the weight
 * given to each scoring term changes.</p>
 */
public enum RoutingStrategy {
    /** Configured weights; the default. */
    BALANCED,
    /** Configured provider weight dominates. */
    QUALITY_FIRST,
    /** Cheapest estimate dominates. */
    COST_OPTIMIZED,
    /** Lowest recent latency dominates. */
    LATENCY_OPTIMIZED
}
