package com.williamcallahan.llmorchestrator.service.routing;

import com.williamcallahan.llmorchestrator.domain.RoutingStrategy;
import java.util.Objects;

/**
 * Router configuration.
 *
 * @param balancedWeights weights of the {@link RoutingStrategy#BALANCED} strategy
 * @param defaultStrategy strategy for requests that do not choose one
 * @param budgetPressureHeadroom remaining-budget fraction below which headroom starts to lower a
 *     provider's score; above it every provider gets full credit
 */
public record RoutingPolicy(
        RoutingWeights balancedWeights, RoutingStrategy defaultStrategy, double budgetPressureHeadroom) {

    public RoutingPolicy {
        Objects.requireNonNull(balancedWeights, "balancedWeights");
        Objects.requireNonNull(defaultStrategy, "defaultStrategy");
        if (budgetPressureHeadroom <= 0 || budgetPressureHeadroom > 1) {
            throw new IllegalArgumentException("budgetPressureHeadroom must be in (0, 1]");
        }
    }

    public static RoutingPolicy defaults() {
        return new RoutingPolicy(RoutingWeights.defaults(), RoutingStrategy.BALANCED, 0.2);
    }

    RoutingWeights weightsFor(RoutingStrategy requested) {
        return RoutingWeights.forStrategy(requested == null ? defaultStrategy : requested, balancedWeights);
    }
}
