package com.williamcallahan.llmorchestrator.service.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies how emitted metrics map onto Micrometer meters.
 */
class MicrometerMetricsSinkTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsSink sink;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new MicrometerMetricsSink(registry);
    }

    @Test
    void emit_recordsLatencyIntoDistributionSummary() {
        sink.emit(MetricNames.PROVIDER_LATENCY, 120, Map.of(MetricNames.TAG_PROVIDER, "openai"));
        sink.emit(MetricNames.PROVIDER_LATENCY, 80, Map.of(MetricNames.TAG_PROVIDER, "openai"));

        DistributionSummary summary = registry.get(MetricNames.PROVIDER_LATENCY)
                .tag(MetricNames.TAG_PROVIDER, "openai")
                .summary();
        assertEquals(2, summary.count());
        assertEquals(200.0, summary.totalAmount(), 1e-9);
    }

    @Test
    void emit_keepsLastValueForBudgetGauge() {
        Map<String, String> tags = Map.of(MetricNames.TAG_PROVIDER, "groq", MetricNames.TAG_PERIOD, "daily");

        sink.emit(MetricNames.BUDGET_REMAINING, 900, tags);
        sink.emit(MetricNames.BUDGET_REMAINING, 640, tags);

        Gauge gauge = registry.get(MetricNames.BUDGET_REMAINING).tags(MetricNames.TAG_PERIOD, "daily").gauge();
        assertEquals(640.0, gauge.value(), 1e-9);
        assertEquals(1, registry.find(MetricNames.BUDGET_REMAINING).gauges().size());
    }

    @Test
    void emit_acceptsUntaggedCounters() {
        sink.emit(MetricNames.COALESCED, 1, null);

        assertEquals(1, registry.get(MetricNames.COALESCED).summary().count());
        assertNull(registry.find(MetricNames.CACHE_LOOKUP).summary());
    }
}
