package com.williamcallahan.llmorchestrator.service.routing;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.RoutingStrategy;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerRegistry;
import com.williamcallahan.llmorchestrator.service.cost.CostLedger;
import com.williamcallahan.llmorchestrator.service.provider.ModelRequest;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClient;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClientRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders eligible providers for a request.
 *
 * <p>A provider is eligible when its breaker would permit a call and it has a free concurrency
 * slot. Eligible providers are ranked by a weighted score: configured weight plus a budget credit,
 * minus the latency and estimated cost each provider carries above the best eligible one. The
 * budget credit is full until remaining headroom falls below the policy's pressure level, so
 * ordinary spend never reorders providers. Scores are compared in bands of {@value #SCORE_BAND};
 * providers in the same band keep their configured static priority, lower first.</p>
 *
 * <p>The weights come from the request's {@link RoutingStrategy}, or the policy default.</p>
 */
public class ProviderRouter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    static final double SCORE_BAND = 0.05;

    private final ProviderClientRegistry providers;
    private final CircuitBreakerRegistry breakers;
    private final ProviderConcurrencyLimiter concurrencyLimiter;
    private final CostLedger costLedger;
    private final LatencyTracker latencyTracker;
    private final RoutingPolicy policy;

    public ProviderRouter(
            ProviderClientRegistry providers,
            CircuitBreakerRegistry breakers,
            ProviderConcurrencyLimiter concurrencyLimiter,
            CostLedger costLedger,
            LatencyTracker latencyTracker,
            RoutingPolicy policy) {
        this.providers = Objects.requireNonNull(providers, "providers");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.concurrencyLimiter = Objects.requireNonNull(concurrencyLimiter, "concurrencyLimiter");
        this.costLedger = Objects.requireNonNull(costLedger, "costLedger");
        this.latencyTracker = Objects.requireNonNull(latencyTracker, "latencyTracker");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Returns eligible providers best first; empty when none is eligible.
     *
     * @param request request to route
     * @return ranked candidates
     */
    public List<RoutingCandidate> candidateProviders(CompletionRequest request) {
        List<Eligible> eligible = new ArrayList<>();
        for (ProviderClient client : providers.all()) {
            String provider = client.name();
            if (!breakers.forProvider(provider).isCallPermitted()) {
                log.debug("Skipping provider with open circuit (provider={})", provider);
                continue;
            }
            if (concurrencyLimiter.availablePermits(provider) <= 0) {
                log.debug("Skipping provider at capacity (provider={})", provider);
                continue;
            }
            ModelRequest modelRequest = ModelRequest.forProvider(request, client.descriptor());
            long estimate = client.estimateCostCents(modelRequest);
            eligible.add(new Eligible(client, modelRequest, estimate, latencyTracker.averageMillis(provider)));
        }
        if (eligible.isEmpty()) {
            return List.of();
        }

        RoutingWeights weights = policy.weightsFor(request.routingStrategy());
        ScoreScale scale = ScoreScale.of(eligible);
        List<RoutingCandidate> ranked = new ArrayList<>(eligible.size());
        for (Eligible candidate : eligible) {
            double score = score(candidate, weights, scale);
            log.debug(
                    "Routing score (provider={}, score={}, estimateCents={}, latencyMs={})",
                    candidate.client().name(),
                    score,
                    candidate.estimatedCents(),
                    candidate.latencyMillis().orElse(-1));
            ranked.add(new RoutingCandidate(candidate.client(), candidate.modelRequest(), candidate.estimatedCents(), score));
        }
        ranked.sort(Comparator.comparingLong((RoutingCandidate candidate) -> -scoreBand(candidate.score()))
                .thenComparingInt(candidate -> candidate.client().descriptor().priority())
                .thenComparing(RoutingCandidate::provider));
        return List.copyOf(ranked);
    }

    private double score(Eligible candidate, RoutingWeights weights, ScoreScale scale) {
        double normalizedWeight = scale.maxWeight() > 0 ? candidate.client().descriptor().weight() / scale.maxWeight() : 0;
        double latencyPenalty = 0;
        if (candidate.latencyMillis().isPresent() && scale.maxLatency() > 0) {
            latencyPenalty = (candidate.latencyMillis().getAsDouble() - scale.minLatency()) / scale.maxLatency();
        }
        double costPenalty = scale.maxEstimate() > 0
                ? (double) (candidate.estimatedCents() - scale.minEstimate()) / scale.maxEstimate()
                : 0;
        return weights.priorityWeight() * normalizedWeight
                + weights.headroomWeight() * budgetCredit(candidate.client().name())
                - weights.latencyWeight() * latencyPenalty
                - weights.costWeight() * costPenalty;
    }

    /** 1.0 while headroom is at or above the pressure level, then falling linearly to 0. */
    private double budgetCredit(String provider) {
        double headroom = costLedger.headroomRatio(provider);
        double pressure = policy.budgetPressureHeadroom();
        return headroom >= pressure ? 1.0 : Math.max(0, headroom) / pressure;
    }

    private static long scoreBand(double score) {
        return (long) Math.floor(score / SCORE_BAND + 1e-9);
    }

    private record Eligible(
            ProviderClient client, ModelRequest modelRequest, long estimatedCents, OptionalDouble latencyMillis) {}

    /** Ranges across the eligible set; providers without latency samples count as the fastest. */
    private record ScoreScale(
            double maxWeight, double minLatency, double maxLatency, long minEstimate, long maxEstimate) {

        static ScoreScale of(List<Eligible> eligible) {
            DoubleSummaryStatistics latency = eligible.stream()
                    .map(Eligible::latencyMillis)
                    .filter(OptionalDouble::isPresent)
                    .mapToDouble(OptionalDouble::getAsDouble)
                    .summaryStatistics();
            LongSummaryStatistics estimates = eligible.stream().mapToLong(Eligible::estimatedCents).summaryStatistics();
            double maxWeight = eligible.stream().mapToDouble(e -> e.client().descriptor().weight()).max().orElse(0);
            return new ScoreScale(
                    maxWeight,
                    latency.getCount() == 0 ? 0 : latency.getMin(),
                    latency.getCount() == 0 ? 0 : latency.getMax(),
                    estimates.getMin(),
                    estimates.getMax());
        }
    }
}
