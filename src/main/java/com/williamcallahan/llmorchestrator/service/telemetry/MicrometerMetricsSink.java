package com.williamcallahan.llmorchestrator.service.telemetry;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsSink} backed by a Micrometer {@link MeterRegistry}.
 *
 * <p>Level-style metrics (budget remaining, breaker state) become gauges holding the last value;
 * everything else is recorded into a distribution summary so counts, totals and percentiles are
 * all available.</p>
 */
public class MicrometerMetricsSink implements MetricsSink {
    private static final Set<String> GAUGE_METRICS = Set.of(MetricNames.BUDGET_REMAINING, MetricNames.BREAKER_STATE);

    private final MeterRegistry registry;
    private final ConcurrentMap<GaugeKey, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void emit(String metricName, double value, Map<String, String> tags) {
        Tags meterTags = toTags(tags);
        if (GAUGE_METRICS.contains(metricName)) {
            gaugeHolder(metricName, meterTags).set(Double.doubleToRawLongBits(value));
            return;
        }
        DistributionSummary.builder(metricName)
                .tags(meterTags)
                .baseUnit(MetricNames.PROVIDER_LATENCY.equals(metricName) ? "milliseconds" : null)
                .register(registry)
                .record(value);
    }

    private AtomicLong gaugeHolder(String metricName, Tags meterTags) {
        return gaugeValues.computeIfAbsent(new GaugeKey(metricName, meterTags), key -> {
            AtomicLong holder = new AtomicLong(Double.doubleToRawLongBits(0.0));
            Gauge.builder(metricName, holder, bits -> Double.longBitsToDouble(bits.get()))
                    .tags(meterTags)
                    .register(registry);
            return holder;
        });
    }

    private static Tags toTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Tags.empty();
        }
        return Tags.of(tags.entrySet().stream()
                .map(entry -> Tag.of(entry.getKey(), entry.getValue() == null ? "" : entry.getValue()))
                .toList());
    }

    private record GaugeKey(String metricName, Tags tags) {}
}
