package com.williamcallahan.llmorchestrator.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Static per-provider configuration loaded at startup.
 *
 * @param name unique provider name, also the rate-limit and budget key
 * @param priority static rank used to break routing ties; lower is preferred
 * @param weight priority weight contributing to the routing score
 * @param costPerKTokenCents cost of one thousand tokens in cents (may be fractional)
 * @param maxConcurrency maximum in-flight calls to this provider
 * @param timeout per-attempt timeout, further bounded by the request deadline
 * @param defaultModel model used when a request does not name one
 */
public record ProviderDescriptor(
        String name,
        int priority,
        double weight,
        BigDecimal costPerKTokenCents,
        int maxConcurrency,
        Duration timeout,
        String defaultModel) {

    public ProviderDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        Objects.requireNonNull(costPerKTokenCents, "costPerKTokenCents");
        Objects.requireNonNull(timeout, "timeout");
        if (costPerKTokenCents.signum() < 0) {
            throw new IllegalArgumentException("costPerKTokenCents cannot be negative");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("weight cannot be negative");
        }
        defaultModel = defaultModel == null ? "" : defaultModel;
    }
}
