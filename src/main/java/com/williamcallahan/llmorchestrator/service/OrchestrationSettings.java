package com.williamcallahan.llmorchestrator.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Behavioral switches of the orchestrator.
 *
 * @param coalescingEnabled whether identical concurrent requests share one upstream call
 * @param coalescingWindow how long a successful shared result stays joinable after completion
 * @param streamBufferSize prefetch of the blocking stream iterator
 */
public record OrchestrationSettings(boolean coalescingEnabled, Duration coalescingWindow, int streamBufferSize) {
    public OrchestrationSettings {
        Objects.requireNonNull(coalescingWindow, "coalescingWindow");
        if (coalescingWindow.isNegative()) {
            throw new IllegalArgumentException("coalescingWindow cannot be negative");
        }
        if (streamBufferSize <= 0) {
            throw new IllegalArgumentException("streamBufferSize must be positive");
        }
    }

    public static OrchestrationSettings defaults() {
        return new OrchestrationSettings(true, Duration.ofMillis(250), 64);
    }
}
