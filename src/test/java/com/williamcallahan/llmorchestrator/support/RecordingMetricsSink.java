package com.williamcallahan.llmorchestrator.support;

import com.williamcallahan.llmorchestrator.service.telemetry.MetricsSink;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Metrics sink that keeps every emission for assertions.
 */
public final class RecordingMetricsSink implements MetricsSink {
    private final List<Emission> emissions = new CopyOnWriteArrayList<>();

    @Override
    public void emit(String metricName, double value, Map<String, String> tags) {
        emissions.add(new Emission(metricName, value, Map.copyOf(tags)));
    }

    public List<Emission> named(String metricName) {
        return emissions.stream().filter(emission -> emission.name().equals(metricName)).toList();
    }

    public long count(String metricName) {
        return named(metricName).size();
    }

    public record Emission(String name, double value, Map<String, String> tags) {}
}
