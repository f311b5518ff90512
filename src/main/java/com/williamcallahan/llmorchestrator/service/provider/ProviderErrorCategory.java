package com.williamcallahan.llmorchestrator.service.provider;

import com.williamcallahan.llmorchestrator.domain.FailureReason;

/**
 * Distinguishable failure categories every provider adapter must surface.
 *
 * <p>Only transient categories make it worthwhile to try another provider; authentication and
 * request-shape problems are the caller's to fix.</p>
 */
public enum ProviderErrorCategory {
    AUTH_ERROR(false, FailureReason.AUTH_ERROR),
    RATE_LIMITED(true, FailureReason.RATE_LIMITED),
    TIMEOUT(true, FailureReason.TIMEOUT),
    SERVER_ERROR(true, FailureReason.SERVER_ERROR),
    INVALID_REQUEST(false, FailureReason.INVALID_REQUEST);

    private final boolean fallbackEligible;
    private final FailureReason failureReason;

    ProviderErrorCategory(boolean fallbackEligible, FailureReason failureReason) {
        this.fallbackEligible = fallbackEligible;
        this.failureReason = failureReason;
    }

    /**
     * Returns whether the orchestrator should advance to the next candidate.
     */
    public boolean isFallbackEligible() {
        return fallbackEligible;
    }

    /**
     * Returns whether the failure says something about the provider's health.
     *
     * <p>Fatal request errors are the caller's fault and never count against the circuit breaker.</p>
     */
    public boolean countsAgainstProviderHealth() {
        return fallbackEligible;
    }

    /** Maps the category to the diagnostic reason reported to callers. */
    public FailureReason toFailureReason() {
        return failureReason;
    }
}
