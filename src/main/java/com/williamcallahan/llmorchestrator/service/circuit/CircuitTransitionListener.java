package com.williamcallahan.llmorchestrator.service.circuit;

/**
 * Observes breaker state changes. Invoked after the breaker's lock is released.
 */
@FunctionalInterface
public interface CircuitTransitionListener {
    CircuitTransitionListener NOOP = (provider, from, to) -> {};

    void onTransition(String provider, CircuitState from, CircuitState to);
}
