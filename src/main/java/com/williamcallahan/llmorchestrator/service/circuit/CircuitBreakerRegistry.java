package com.williamcallahan.llmorchestrator.service.circuit;

import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricsSink;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One breaker per registered provider, created at startup and kept for the process lifetime.
 */
public class CircuitBreakerRegistry {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, ProviderCircuitBreaker> breakers;
    private final MetricsSink metricsSink;

    public CircuitBreakerRegistry(
            Collection<String> providerNames, CircuitBreakerSettings settings, Clock clock, MetricsSink metricsSink) {
        this.metricsSink = metricsSink;
        Map<String, ProviderCircuitBreaker> created = new LinkedHashMap<>();
        for (String providerName : providerNames) {
            created.put(providerName, new ProviderCircuitBreaker(providerName, settings, clock, this::onTransition));
            metricsSink.emit(
                    MetricNames.BREAKER_STATE,
                    CircuitState.CLOSED.gaugeValue(),
                    Map.of(MetricNames.TAG_PROVIDER, providerName));
        }
        this.breakers = Map.copyOf(created);
    }

    /**
     * Returns the breaker for a registered provider.
     *
     * @throws IllegalArgumentException for unknown providers
     */
    public ProviderCircuitBreaker forProvider(String providerName) {
        ProviderCircuitBreaker breaker = breakers.get(providerName);
        if (breaker == null) {
            throw new IllegalArgumentException("No circuit breaker for provider: " + providerName);
        }
        return breaker;
    }

    public Optional<ProviderCircuitBreaker> find(String providerName) {
        return Optional.ofNullable(breakers.get(providerName));
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(ProviderCircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::provider))
                .toList();
    }

    /**
     * Forces a provider's breaker closed.
     *
     * @return false when the provider is unknown
     */
    public boolean forceClose(String providerName) {
        ProviderCircuitBreaker breaker = breakers.get(providerName);
        if (breaker == null) {
            return false;
        }
        log.info("Circuit breaker force-closed by operator (provider={})", providerName);
        breaker.forceClose();
        return true;
    }

    private void onTransition(String provider, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit opened (provider={}, from={})", provider, from);
        } else {
            log.info("Circuit transition (provider={}, from={}, to={})", provider, from, to);
        }
        Map<String, String> tags = Map.of(
                MetricNames.TAG_PROVIDER, provider,
                MetricNames.TAG_STATE, to.name().toLowerCase(Locale.ROOT));
        metricsSink.emit(MetricNames.BREAKER_TRANSITION, 1, tags);
        metricsSink.emit(MetricNames.BREAKER_STATE, to.gaugeValue(), Map.of(MetricNames.TAG_PROVIDER, provider));
    }
}
