package com.williamcallahan.llmorchestrator.service.circuit;

/**
 * Answer to {@link ProviderCircuitBreaker#tryAcquirePermission()}.
 */
public enum CallPermission {
    /** Breaker is open or a half-open trial is already running. */
    DENIED,
    /** Breaker is closed. */
    GRANTED,
    /** The single half-open trial; its outcome decides the next state. */
    TRIAL;

    public boolean isGranted() {
        return this != DENIED;
    }
}
