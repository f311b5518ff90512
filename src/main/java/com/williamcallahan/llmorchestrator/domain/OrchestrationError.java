package com.williamcallahan.llmorchestrator.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Structured terminal error returned to callers.
 *
 * @param code stable reason code
 * @param message user-facing summary
 * @param retryAfter suggested delay before retrying, zero when retrying is pointless
 * @param providerFailures per-provider diagnostics, empty when no provider was attempted
 */
public record OrchestrationError(
        ErrorCode code, String message, Duration retryAfter, List<ProviderFailure> providerFailures) {

    public OrchestrationError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
        providerFailures = providerFailures == null ? List.of() : List.copyOf(providerFailures);
    }

    public static OrchestrationError rateLimited(String scopeKey, Duration retryAfter) {
        return new OrchestrationError(
                ErrorCode.RATE_LIMITED, "Rate limit exceeded for " + scopeKey, retryAfter, List.of());
    }

    public static OrchestrationError budgetExceeded(List<ProviderFailure> failures) {
        return new OrchestrationError(
                ErrorCode.BUDGET_EXCEEDED, "No provider can serve the request within budget", Duration.ZERO, failures);
    }

    public static OrchestrationError allProvidersExhausted(List<ProviderFailure> failures) {
        String message = failures.isEmpty()
                ? "No provider is currently eligible"
                : "All " + failures.size() + " candidate providers failed";
        return new OrchestrationError(ErrorCode.ALL_PROVIDERS_EXHAUSTED, message, Duration.ZERO, failures);
    }

    public static OrchestrationError fatal(ProviderFailure failure) {
        return new OrchestrationError(
                ErrorCode.FATAL_REQUEST_ERROR,
                "Request rejected by " + failure.provider() + ": " + failure.reason(),
                Duration.ZERO,
                List.of(failure));
    }

    public static OrchestrationError timeout(List<ProviderFailure> failures) {
        return new OrchestrationError(
                ErrorCode.TIMEOUT, "Request deadline passed before a result was available", Duration.ZERO, failures);
    }

    public static OrchestrationError cancelled() {
        return new OrchestrationError(ErrorCode.CANCELLED, "Request cancelled by caller", Duration.ZERO, List.of());
    }

    public static OrchestrationError streamInterrupted(ProviderFailure failure) {
        return new OrchestrationError(
                ErrorCode.STREAM_INTERRUPTED,
                "Stream from " + failure.provider() + " ended early: " + failure.reason(),
                Duration.ZERO,
                List.of(failure));
    }
}
