package com.williamcallahan.llmorchestrator.service.telemetry;

import java.util.Map;

/**
 * Receives orchestration measurements.
 *
 * <p>Implementations must be non-blocking and thread-safe; emitters call them from request
 * threads and never expect a result.</p>
 */
@FunctionalInterface
public interface MetricsSink {

    /** Sink that discards everything. */
    MetricsSink NOOP = (metricName, value, tags) -> {};

    /**
     * Records one measurement.
     *
     * @param metricName metric name, see {@link MetricNames}
     * @param value measured value
     * @param tags dimension tags, never containing prompt text
     */
    void emit(String metricName, double value, Map<String, String> tags);
}
