package com.williamcallahan.llmorchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import com.williamcallahan.llmorchestrator.service.CompletionOrchestrator;
import com.williamcallahan.llmorchestrator.service.OrchestrationContext;
import com.williamcallahan.llmorchestrator.service.OrchestrationSettings;
import com.williamcallahan.llmorchestrator.service.cache.CachedCompletionCodec;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCache;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCacheSettings;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerRegistry;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerSettings;
import com.williamcallahan.llmorchestrator.service.cost.BudgetLimits;
import com.williamcallahan.llmorchestrator.service.cost.CostEstimator;
import com.williamcallahan.llmorchestrator.service.cost.CostLedger;
import com.williamcallahan.llmorchestrator.service.cost.TokenCounter;
import com.williamcallahan.llmorchestrator.service.history.AttemptHistory;
import com.williamcallahan.llmorchestrator.service.provider.OpenAiCompatibleProviderClient;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClient;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClientRegistry;
import com.williamcallahan.llmorchestrator.service.ratelimit.TokenBucketRateLimiter;
import com.williamcallahan.llmorchestrator.service.routing.LatencyTracker;
import com.williamcallahan.llmorchestrator.service.routing.ProviderConcurrencyLimiter;
import com.williamcallahan.llmorchestrator.service.routing.ProviderRouter;
import com.williamcallahan.llmorchestrator.service.routing.RoutingPolicy;
import com.williamcallahan.llmorchestrator.service.routing.RoutingWeights;
import com.williamcallahan.llmorchestrator.service.telemetry.AsyncUsageRecorder;
import com.williamcallahan.llmorchestrator.service.telemetry.JsonLinesUsageWriter;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricsSink;
import com.williamcallahan.llmorchestrator.service.telemetry.MicrometerMetricsSink;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the orchestration core from {@link OrchestratorProperties}.
 *
 * <p>The core classes carry no Spring annotations; this is the only place they meet the container.</p>
 */
@Configuration
public class OrchestratorConfig {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock orchestratorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricsSink metricsSink(MeterRegistry meterRegistry) {
        return new MicrometerMetricsSink(meterRegistry);
    }

    @Bean
    public CostEstimator costEstimator() {
        return new CostEstimator(new TokenCounter());
    }

    /**
     * Builds one adapter per enabled provider. Providers without an API key are skipped with a warning
     * so a partially configured deployment still starts.
     */
    @Bean
    public ProviderClientRegistry providerClientRegistry(OrchestratorProperties properties, CostEstimator costEstimator) {
        List<ProviderClient> clients = new ArrayList<>();
        for (ProviderConfig provider : properties.getProviders()) {
            if (!provider.isEnabled()) {
                log.info("Provider disabled by configuration (provider={})", provider.getName());
                continue;
            }
            if (!provider.hasApiKey()) {
                log.warn("Provider has no API key configured, skipping (provider={})", provider.getName());
                continue;
            }
            clients.add(OpenAiCompatibleProviderClient.create(
                    provider.toDescriptor(), provider.getBaseUrl(), provider.getApiKey(), costEstimator));
        }
        if (clients.isEmpty()) {
            throw new IllegalStateException("No provider is enabled with an API key; configure orchestrator.providers");
        }
        log.info("Provider registry ready (providers={})", clients.stream().map(ProviderClient::name).toList());
        return new ProviderClientRegistry(clients);
    }

    @Bean
    public CostLedger costLedger(
            OrchestratorProperties properties, ProviderClientRegistry registry, Clock clock, MetricsSink metricsSink) {
        Map<String, BudgetLimits> limits = new LinkedHashMap<>();
        for (ProviderConfig provider : properties.getProviders()) {
            if (registry.find(provider.getName()).isPresent()) {
                limits.put(provider.getName(), provider.toBudgetLimits());
            }
        }
        OrchestratorProperties.Budget budget = properties.getBudget();
        return new CostLedger(limits, clock, ZoneId.of(budget.getZoneId()), budget.getWarningThreshold(), metricsSink);
    }

    @Bean
    public TokenBucketRateLimiter tokenBucketRateLimiter(
            OrchestratorProperties properties, Clock clock, MetricsSink metricsSink) {
        RateLimitConfig rateLimit = properties.getRateLimit();
        return new TokenBucketRateLimiter(
                rateLimit.policies(), rateLimit.getGlobal().toPolicy(), rateLimit.getMaxBuckets(), clock, metricsSink);
    }

    @Bean
    public ResponseCache responseCache(OrchestratorProperties properties, Clock clock, MetricsSink metricsSink) {
        OrchestratorProperties.Cache cache = properties.getCache();
        ResponseCacheSettings settings = new ResponseCacheSettings(
                cache.getMaxBytes(), cache.getShards(), cache.getCompressionThresholdBytes(), cache.getTtl());
        return new ResponseCache(settings, clock, metricsSink);
    }

    @Bean
    public CachedCompletionCodec cachedCompletionCodec(ObjectMapper objectMapper) {
        return new CachedCompletionCodec(objectMapper);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            OrchestratorProperties properties, ProviderClientRegistry registry, Clock clock, MetricsSink metricsSink) {
        OrchestratorProperties.Circuit circuit = properties.getCircuit();
        CircuitBreakerSettings settings = new CircuitBreakerSettings(
                circuit.getFailureThreshold(), circuit.getCoolDown(), circuit.getMaxCoolDown());
        return new CircuitBreakerRegistry(registry.names(), settings, clock, metricsSink);
    }

    @Bean
    public ProviderConcurrencyLimiter providerConcurrencyLimiter(ProviderClientRegistry registry) {
        List<ProviderDescriptor> descriptors = registry.all().stream().map(ProviderClient::descriptor).toList();
        return new ProviderConcurrencyLimiter(descriptors);
    }

    @Bean
    public LatencyTracker latencyTracker(OrchestratorProperties properties) {
        return new LatencyTracker(properties.getRouting().getLatencyAlpha());
    }

    @Bean
    public ProviderRouter providerRouter(
            OrchestratorProperties properties,
            ProviderClientRegistry registry,
            CircuitBreakerRegistry breakers,
            ProviderConcurrencyLimiter concurrencyLimiter,
            CostLedger costLedger,
            LatencyTracker latencyTracker) {
        OrchestratorProperties.Routing routing = properties.getRouting();
        RoutingWeights weights = new RoutingWeights(
                routing.getPriorityWeight(), routing.getHeadroomWeight(), routing.getLatencyWeight(), routing.getCostWeight());
        RoutingPolicy policy = new RoutingPolicy(weights, routing.getStrategy(), routing.getBudgetPressureHeadroom());
        return new ProviderRouter(registry, breakers, concurrencyLimiter, costLedger, latencyTracker, policy);
    }

    @Bean
    public AttemptHistory attemptHistory(OrchestratorProperties properties, Clock clock) {
        return new AttemptHistory(properties.getHistory().getCapacity(), clock);
    }

    @Bean(destroyMethod = "close")
    public AsyncUsageRecorder usageRecorder(
            OrchestratorProperties properties, ObjectMapper objectMapper, MetricsSink metricsSink) {
        OrchestratorProperties.Usage usage = properties.getUsage();
        JsonLinesUsageWriter writer = new JsonLinesUsageWriter(Path.of(usage.getDirectory()), objectMapper);
        return new AsyncUsageRecorder(usage.getQueueCapacity(), writer, metricsSink);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("provider-call-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService batchRequestExecutor() {
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("batch-request-"));
    }

    @Bean
    public CompletionOrchestrator completionOrchestrator(
            OrchestratorProperties properties,
            TokenBucketRateLimiter rateLimiter,
            CostLedger costLedger,
            ResponseCache responseCache,
            CachedCompletionCodec cacheCodec,
            CircuitBreakerRegistry breakers,
            ProviderRouter router,
            ProviderConcurrencyLimiter concurrencyLimiter,
            LatencyTracker latencyTracker,
            AsyncUsageRecorder usageRecorder,
            MetricsSink metricsSink,
            AttemptHistory attemptHistory,
            Clock clock,
            ExecutorService providerCallExecutor,
            ExecutorService batchRequestExecutor) {
        OrchestrationContext context = new OrchestrationContext(
                rateLimiter,
                costLedger,
                responseCache,
                cacheCodec,
                breakers,
                router,
                concurrencyLimiter,
                latencyTracker,
                usageRecorder,
                metricsSink,
                attemptHistory,
                clock,
                providerCallExecutor,
                batchRequestExecutor);
        OrchestrationSettings settings = new OrchestrationSettings(
                properties.getCoalescing().isEnabled(),
                properties.getCoalescing().getWindow(),
                properties.getStreaming().getBufferSize());
        return new CompletionOrchestrator(context, settings);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
