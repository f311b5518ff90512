package com.williamcallahan.llmorchestrator.service.routing;

import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Exponential moving average of observed provider latency.
 */
public class LatencyTracker {
    private static final long NO_SAMPLE = Double.doubleToRawLongBits(Double.NaN);

    private final double alpha;
    private final ConcurrentMap<String, AtomicLong> averageBitsByProvider = new ConcurrentHashMap<>();

    /**
     * @param alpha weight of the newest sample, in (0, 1]
     */
    public LatencyTracker(double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1]");
        }
        this.alpha = alpha;
    }

    public void record(String provider, Duration latency) {
        double sampleMillis = Math.max(0L, latency.toMillis());
        AtomicLong averageBits = averageBitsByProvider.computeIfAbsent(provider, name -> new AtomicLong(NO_SAMPLE));
        while (true) {
            long currentBits = averageBits.get();
            double current = Double.longBitsToDouble(currentBits);
            double updated = Double.isNaN(current) ? sampleMillis : alpha * sampleMillis + (1 - alpha) * current;
            if (averageBits.compareAndSet(currentBits, Double.doubleToRawLongBits(updated))) {
                return;
            }
        }
    }

    /** Average latency in milliseconds, empty before the first sample. */
    public OptionalDouble averageMillis(String provider) {
        AtomicLong averageBits = averageBitsByProvider.get(provider);
        if (averageBits == null) {
            return OptionalDouble.empty();
        }
        double average = Double.longBitsToDouble(averageBits.get());
        return Double.isNaN(average) ? OptionalDouble.empty() : OptionalDouble.of(average);
    }
}
