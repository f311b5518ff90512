package com.williamcallahan.llmorchestrator.service.circuit;

/**
 * Health states of a provider circuit breaker.
 */
public enum CircuitState {
    /** Calls flow; consecutive failures are counted. */
    CLOSED(0),
    /** Calls are refused until the cool-down elapses. */
    OPEN(2),
    /** A single trial call decides between closing and reopening. */
    HALF_OPEN(1);

    private final int gaugeValue;

    CircuitState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /** Numeric value reported to gauges: 0 closed, 1 half-open, 2 open. */
    public int gaugeValue() {
        return gaugeValue;
    }
}
