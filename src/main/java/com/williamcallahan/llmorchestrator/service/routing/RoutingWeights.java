package com.williamcallahan.llmorchestrator.service.routing;

import com.williamcallahan.llmorchestrator.domain.RoutingStrategy;

/**
 * Coefficients of the candidate score.
 *
 * @param priorityWeight multiplier for the provider's configured weight (normalized to [0, 1])
 * @param headroomWeight multiplier for the budget credit, which only drops under budget pressure
 * @param latencyWeight penalty multiplier for recent latency above the fastest eligible provider
 * @param costWeight penalty multiplier for estimated cost above the cheapest eligible provider
 */
public record RoutingWeights(double priorityWeight, double headroomWeight, double latencyWeight, double costWeight) {
    private static final RoutingWeights QUALITY_FIRST = new RoutingWeights(1.0, 0.5, 0.0, 0.0);
    private static final RoutingWeights COST_OPTIMIZED = new RoutingWeights(0.25, 0.5, 0.0, 1.0);
    private static final RoutingWeights LATENCY_OPTIMIZED = new RoutingWeights(0.25, 0.5, 1.0, 0.0);

    public RoutingWeights {
        if (priorityWeight < 0 || headroomWeight < 0 || latencyWeight < 0 || costWeight < 0) {
            throw new IllegalArgumentException("routing weights cannot be negative");
        }
    }

    public static RoutingWeights defaults() {
        return new RoutingWeights(1.0, 0.5, 0.25, 0.25);
    }

    /**
     * Weights used for a strategy; {@code BALANCED} uses the configured {@code balanced} set.
     */
    public static RoutingWeights forStrategy(RoutingStrategy strategy, RoutingWeights balanced) {
        return switch (strategy) {
            case BALANCED -> balanced;
            case QUALITY_FIRST -> QUALITY_FIRST;
            case COST_OPTIMIZED -> COST_OPTIMIZED;
            case LATENCY_OPTIMIZED -> LATENCY_OPTIMIZED;
        };
    }
}
