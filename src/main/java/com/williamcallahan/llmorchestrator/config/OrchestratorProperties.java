package com.williamcallahan.llmorchestrator.config;

import com.williamcallahan.llmorchestrator.domain.RoutingStrategy;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of the {@code orchestrator.*} configuration tree.
 */
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private static final String NO_PROVIDERS_MSG = "orchestrator.providers must list at least one provider.";
    private static final String DUPLICATE_FMT = "Duplicate provider name: %s";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEGATIVE_FMT = "%s must not be negative.";
    private static final String RATIO_FMT = "%s must be in (0, 1].";

    private List<ProviderConfig> providers = new ArrayList<>();
    private Budget budget = new Budget();
    private Cache cache = new Cache();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private Circuit circuit = new Circuit();
    private Routing routing = new Routing();
    private Coalescing coalescing = new Coalescing();
    private Streaming streaming = new Streaming();
    private Usage usage = new Usage();
    private History history = new History();

    /**
     * Validates the whole tree; invalid configuration fails startup.
     */
    @PostConstruct
    public void validateConfiguration() {
        if (providers.isEmpty()) {
            throw new IllegalStateException(NO_PROVIDERS_MSG);
        }
        Set<String> names = new HashSet<>();
        for (ProviderConfig provider : providers) {
            provider.validateConfiguration();
            if (!names.add(provider.getName())) {
                throw new IllegalStateException(String.format(Locale.ROOT, DUPLICATE_FMT, provider.getName()));
            }
        }
        budget.validateConfiguration();
        cache.validateConfiguration();
        rateLimit.validateConfiguration();
        circuit.validateConfiguration();
        routing.validateConfiguration();
        coalescing.validateConfiguration();
        streaming.validateConfiguration();
        usage.validateConfiguration();
        history.validateConfiguration();
    }

    public List<ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderConfig> providers) {
        this.providers = providers == null ? new ArrayList<>() : providers;
    }

    public Budget getBudget() {
        return budget;
    }

    public void setBudget(Budget budget) {
        this.budget = budget;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public RateLimitConfig getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimitConfig rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Circuit getCircuit() {
        return circuit;
    }

    public void setCircuit(Circuit circuit) {
        this.circuit = circuit;
    }

    public Routing getRouting() {
        return routing;
    }

    public void setRouting(Routing routing) {
        this.routing = routing;
    }

    public Coalescing getCoalescing() {
        return coalescing;
    }

    public void setCoalescing(Coalescing coalescing) {
        this.coalescing = coalescing;
    }

    public Streaming getStreaming() {
        return streaming;
    }

    public void setStreaming(Streaming streaming) {
        this.streaming = streaming;
    }

    public Usage getUsage() {
        return usage;
    }

    public void setUsage(Usage usage) {
        this.usage = usage;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    private static void requirePositive(String key, long value) {
        if (value < 1) {
            throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    private static void requireNonNegative(String key, double value) {
        if (value < 0) {
            throw new IllegalStateException(String.format(Locale.ROOT, NON_NEGATIVE_FMT, key));
        }
    }

    public static class Budget {
        private double warningThreshold = 0.8;
        private String zoneId = "UTC";
        private Duration rolloverInterval = Duration.ofMinutes(1);

        void validateConfiguration() {
            if (warningThreshold <= 0 || warningThreshold > 1) {
                throw new IllegalStateException(
                        String.format(Locale.ROOT, RATIO_FMT, "orchestrator.budget.warning-threshold"));
            }
            try {
                ZoneId.of(zoneId);
            } catch (RuntimeException invalidZone) {
                throw new IllegalStateException("orchestrator.budget.zone-id is not a valid zone: " + zoneId, invalidZone);
            }
            requirePositive("orchestrator.budget.rollover-interval", rolloverInterval);
        }

        public double getWarningThreshold() { return warningThreshold; }
        public void setWarningThreshold(double warningThreshold) { this.warningThreshold = warningThreshold; }

        public String getZoneId() { return zoneId; }
        public void setZoneId(String zoneId) { this.zoneId = zoneId; }

        public Duration getRolloverInterval() { return rolloverInterval; }
        public void setRolloverInterval(Duration rolloverInterval) { this.rolloverInterval = rolloverInterval; }
    }

    public static class Cache {
        private long maxBytes = 64L * 1024 * 1024;
        private int shards = 16;
        private int compressionThresholdBytes = 4 * 1024;
        private Duration ttl = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofMinutes(5);

        void validateConfiguration() {
            requirePositive("orchestrator.cache.max-bytes", maxBytes);
            requirePositive("orchestrator.cache.shards", shards);
            requirePositive("orchestrator.cache.compression-threshold-bytes", compressionThresholdBytes);
            requirePositive("orchestrator.cache.ttl", ttl);
            requirePositive("orchestrator.cache.sweep-interval", sweepInterval);
            if (maxBytes < shards) {
                throw new IllegalStateException("orchestrator.cache.max-bytes must be at least the shard count.");
            }
        }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

        public int getShards() { return shards; }
        public void setShards(int shards) { this.shards = shards; }

        public int getCompressionThresholdBytes() { return compressionThresholdBytes; }
        public void setCompressionThresholdBytes(int compressionThresholdBytes) {
            this.compressionThresholdBytes = compressionThresholdBytes;
        }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class Circuit {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);
        private Duration maxCoolDown = Duration.ofMinutes(10);

        void validateConfiguration() {
            requirePositive("orchestrator.circuit.failure-threshold", failureThreshold);
            requirePositive("orchestrator.circuit.cool-down", coolDown);
            requirePositive("orchestrator.circuit.max-cool-down", maxCoolDown);
            if (maxCoolDown.compareTo(coolDown) < 0) {
                throw new IllegalStateException("orchestrator.circuit.max-cool-down must not be below cool-down.");
            }
        }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public Duration getCoolDown() { return coolDown; }
        public void setCoolDown(Duration coolDown) { this.coolDown = coolDown; }

        public Duration getMaxCoolDown() { return maxCoolDown; }
        public void setMaxCoolDown(Duration maxCoolDown) { this.maxCoolDown = maxCoolDown; }
    }

    public static class Routing {
        private double priorityWeight = 1.0;
        private double headroomWeight = 0.5;
        private double latencyWeight = 0.25;
        private double costWeight = 0.25;
        private double latencyAlpha = 0.2;
        private RoutingStrategy strategy = RoutingStrategy.BALANCED;
        private double budgetPressureHeadroom = 0.2;

        void validateConfiguration() {
            requireNonNegative("orchestrator.routing.priority-weight", priorityWeight);
            requireNonNegative("orchestrator.routing.headroom-weight", headroomWeight);
            requireNonNegative("orchestrator.routing.latency-weight", latencyWeight);
            requireNonNegative("orchestrator.routing.cost-weight", costWeight);
            if (latencyAlpha <= 0 || latencyAlpha > 1) {
                throw new IllegalStateException(
                        String.format(Locale.ROOT, RATIO_FMT, "orchestrator.routing.latency-alpha"));
            }
            if (strategy == null) {
                throw new IllegalStateException("orchestrator.routing.strategy must be set.");
            }
            if (budgetPressureHeadroom <= 0 || budgetPressureHeadroom > 1) {
                throw new IllegalStateException(
                        String.format(Locale.ROOT, RATIO_FMT, "orchestrator.routing.budget-pressure-headroom"));
            }
        }

        public double getPriorityWeight() { return priorityWeight; }
        public void setPriorityWeight(double priorityWeight) { this.priorityWeight = priorityWeight; }

        public double getHeadroomWeight() { return headroomWeight; }
        public void setHeadroomWeight(double headroomWeight) { this.headroomWeight = headroomWeight; }

        public double getLatencyWeight() { return latencyWeight; }
        public void setLatencyWeight(double latencyWeight) { this.latencyWeight = latencyWeight; }

        public double getCostWeight() { return costWeight; }
        public void setCostWeight(double costWeight) { this.costWeight = costWeight; }

        public double getLatencyAlpha() { return latencyAlpha; }
        public void setLatencyAlpha(double latencyAlpha) { this.latencyAlpha = latencyAlpha; }

        public RoutingStrategy getStrategy() { return strategy; }
        public void setStrategy(RoutingStrategy strategy) { this.strategy = strategy; }

        public double getBudgetPressureHeadroom() { return budgetPressureHeadroom; }
        public void setBudgetPressureHeadroom(double budgetPressureHeadroom) {
            this.budgetPressureHeadroom = budgetPressureHeadroom;
        }
    }

    public static class Coalescing {
        private boolean enabled = true;
        private Duration window = Duration.ofMillis(250);

        void validateConfiguration() {
            if (window == null || window.isNegative()) {
                throw new IllegalStateException(
                        String.format(Locale.ROOT, NON_NEGATIVE_FMT, "orchestrator.coalescing.window"));
            }
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    public static class Streaming {
        private int bufferSize = 64;

        void validateConfiguration() {
            requirePositive("orchestrator.streaming.buffer-size", bufferSize);
        }

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }
    }

    public static class Usage {
        private int queueCapacity = 10_000;
        private String directory = "data/usage";

        void validateConfiguration() {
            requirePositive("orchestrator.usage.queue-capacity", queueCapacity);
            if (directory == null || directory.isBlank()) {
                throw new IllegalStateException("orchestrator.usage.directory must not be blank.");
            }
        }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class History {
        private int capacity = 1_000;

        void validateConfiguration() {
            requirePositive("orchestrator.history.capacity", capacity);
        }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }
}
