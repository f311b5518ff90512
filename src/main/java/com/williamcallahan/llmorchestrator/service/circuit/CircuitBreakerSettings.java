package com.williamcallahan.llmorchestrator.service.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds shared by every provider breaker.
 *
 * @param failureThreshold consecutive failures that open a closed breaker
 * @param coolDown initial wait before a half-open trial
 * @param maxCoolDown ceiling for the doubled cool-down after failed trials
 */
public record CircuitBreakerSettings(int failureThreshold, Duration coolDown, Duration maxCoolDown) {
    public CircuitBreakerSettings {
        Objects.requireNonNull(coolDown, "coolDown");
        Objects.requireNonNull(maxCoolDown, "maxCoolDown");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (coolDown.isNegative() || coolDown.isZero()) {
            throw new IllegalArgumentException("coolDown must be positive");
        }
        if (maxCoolDown.compareTo(coolDown) < 0) {
            throw new IllegalArgumentException("maxCoolDown must not be shorter than coolDown");
        }
    }
}
