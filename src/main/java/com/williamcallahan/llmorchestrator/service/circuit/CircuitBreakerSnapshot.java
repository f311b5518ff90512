package com.williamcallahan.llmorchestrator.service.circuit;

import java.time.Duration;
import java.time.Instant;

/**
 * Diagnostic view of one provider breaker.
 *
 * @param provider provider name
 * @param state current state
 * @param failureCount consecutive failures counted in the current state
 * @param lastFailureAt time of the last recorded failure, null if none
 * @param nextTrialAt earliest half-open trial while open, null otherwise
 * @param currentCoolDown cool-down applied the next time the breaker opens from half-open
 * @param successfulCalls successes recorded since start
 * @param failedCalls failures recorded since start
 * @param rejectedCalls calls refused while open or while a trial was in flight
 */
public record CircuitBreakerSnapshot(
        String provider,
        CircuitState state,
        int failureCount,
        Instant lastFailureAt,
        Instant nextTrialAt,
        Duration currentCoolDown,
        long successfulCalls,
        long failedCalls,
        long rejectedCalls) {}
