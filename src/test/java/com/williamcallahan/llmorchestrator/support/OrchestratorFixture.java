package com.williamcallahan.llmorchestrator.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.ModelParameters;
import com.williamcallahan.llmorchestrator.service.CompletionOrchestrator;
import com.williamcallahan.llmorchestrator.service.OrchestrationContext;
import com.williamcallahan.llmorchestrator.service.OrchestrationSettings;
import com.williamcallahan.llmorchestrator.service.cache.CachedCompletionCodec;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCache;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCacheSettings;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerRegistry;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerSettings;
import com.williamcallahan.llmorchestrator.service.cost.BudgetLimits;
import com.williamcallahan.llmorchestrator.service.cost.CostLedger;
import com.williamcallahan.llmorchestrator.service.history.AttemptHistory;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClient;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClientRegistry;
import com.williamcallahan.llmorchestrator.service.ratelimit.BucketPolicy;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitScope;
import com.williamcallahan.llmorchestrator.service.ratelimit.TokenBucketRateLimiter;
import com.williamcallahan.llmorchestrator.service.routing.LatencyTracker;
import com.williamcallahan.llmorchestrator.service.routing.ProviderConcurrencyLimiter;
import com.williamcallahan.llmorchestrator.service.routing.ProviderRouter;
import com.williamcallahan.llmorchestrator.service.routing.RoutingPolicy;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fully wired orchestrator over scripted providers, with every collaborator exposed for assertions.
 */
public final class OrchestratorFixture implements AutoCloseable {
    public static final String START = "2025-03-15T12:00:00Z";

    public final MutableClock clock;
    public final RecordingMetricsSink metrics = new RecordingMetricsSink();
    public final RecordingUsageSink usage = new RecordingUsageSink();
    public final ProviderClientRegistry registry;
    public final CostLedger ledger;
    public final TokenBucketRateLimiter rateLimiter;
    public final ResponseCache cache;
    public final CircuitBreakerRegistry breakers;
    public final ProviderConcurrencyLimiter concurrency;
    public final LatencyTracker latency;
    public final ProviderRouter router;
    public final AttemptHistory history;
    public final ExecutorService providerExecutor = Executors.newCachedThreadPool();
    public final ExecutorService requestExecutor = Executors.newFixedThreadPool(8);
    public final CompletionOrchestrator orchestrator;

    private OrchestratorFixture(Builder builder) {
        this.clock = MutableClock.at(START);
        this.registry = new ProviderClientRegistry(builder.clients);
        Map<String, BudgetLimits> limits = new LinkedHashMap<>();
        for (ProviderClient client : builder.clients) {
            limits.put(client.name(), builder.limits.getOrDefault(client.name(), builder.defaultLimits));
        }
        this.ledger = new CostLedger(limits, clock, ZoneOffset.UTC, 0.8, metrics);
        this.rateLimiter = new TokenBucketRateLimiter(builder.policies, new BucketPolicy(1_000, 1_000), 1_000, clock, metrics);
        this.cache = new ResponseCache(
                new ResponseCacheSettings(1024 * 1024, 4, 2048, Duration.ofMinutes(10)), clock, metrics);
        this.breakers = new CircuitBreakerRegistry(
                registry.names(),
                new CircuitBreakerSettings(builder.failureThreshold, Duration.ofSeconds(30), Duration.ofMinutes(5)),
                clock,
                metrics);
        this.concurrency = new ProviderConcurrencyLimiter(
                registry.all().stream().map(ProviderClient::descriptor).toList());
        this.latency = new LatencyTracker(0.2);
        this.router = new ProviderRouter(registry, breakers, concurrency, ledger, latency, RoutingPolicy.defaults());
        this.history = new AttemptHistory(256, clock);
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        OrchestrationContext context = new OrchestrationContext(
                rateLimiter,
                ledger,
                cache,
                new CachedCompletionCodec(objectMapper),
                breakers,
                router,
                concurrency,
                latency,
                usage,
                metrics,
                history,
                clock,
                providerExecutor,
                requestExecutor);
        this.orchestrator = new CompletionOrchestrator(context, builder.settings);
    }

    public static Builder with(ProviderClient... clients) {
        return new Builder(List.of(clients));
    }

    /** Request with a deadline one minute after the fixture clock. */
    public CompletionRequest request(String prompt) {
        return requestBuilder(prompt).build();
    }

    public CompletionRequest.Builder requestBuilder(String prompt) {
        return CompletionRequest.builder(prompt)
                .parameters(new ModelParameters(ModelParameters.DEFAULT_MODEL, 0.0, 256))
                .deadline(clock.instant().plus(Duration.ofMinutes(1)));
    }

    @Override
    public void close() {
        providerExecutor.shutdownNow();
        requestExecutor.shutdownNow();
    }

    public static final class Builder {
        private final List<ProviderClient> clients;
        private final Map<String, BudgetLimits> limits = new LinkedHashMap<>();
        private final Map<RateLimitScope, BucketPolicy> policies = new EnumMap<>(RateLimitScope.class);
        private BudgetLimits defaultLimits = new BudgetLimits(1_000, 10_000);
        private int failureThreshold = 3;
        private OrchestrationSettings settings = new OrchestrationSettings(false, Duration.ZERO, 16);

        private Builder(List<ProviderClient> clients) {
            this.clients = clients;
        }

        public Builder limits(String provider, long dailyCents, long monthlyCents) {
            limits.put(provider, new BudgetLimits(dailyCents, monthlyCents));
            return this;
        }

        public Builder defaultLimits(long dailyCents, long monthlyCents) {
            this.defaultLimits = new BudgetLimits(dailyCents, monthlyCents);
            return this;
        }

        public Builder rateLimit(RateLimitScope scope, int capacity, double refillPerSecond) {
            policies.put(scope, new BucketPolicy(capacity, refillPerSecond));
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder coalescing(Duration window) {
            this.settings = new OrchestrationSettings(true, window, 16);
            return this;
        }

        public OrchestratorFixture build() {
            return new OrchestratorFixture(this);
        }
    }
}
