package com.williamcallahan.llmorchestrator.domain.errors;

import com.williamcallahan.llmorchestrator.domain.OrchestrationError;
import com.williamcallahan.llmorchestrator.domain.ProviderFailure;
import java.util.List;
import java.util.Objects;

/**
 * Describes a standard JSON error payload that API clients can interpret uniformly.
 *
 * @param status fixed status indicator (typically "error")
 * @param message user-facing error message
 * @param code stable reason code, null for generic errors
 * @param retryAfterSeconds suggested retry delay, zero when retrying will not help
 * @param providerFailures per-provider diagnostics, empty when no provider was attempted
 */
public record ApiErrorResponse(
        String status, String message, String code, long retryAfterSeconds, List<ProviderFailure> providerFailures)
        implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
        providerFailures = providerFailures == null ? List.of() : List.copyOf(providerFailures);
    }

    /**
     * Creates an error response with no orchestration context.
     *
     * @param message user-facing error message
     * @return standardized error payload
     */
    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null, 0L, List.of());
    }

    /**
     * Creates an error response from a terminal orchestration error.
     *
     * @param error structured error
     * @return standardized error payload
     */
    public static ApiErrorResponse from(OrchestrationError error) {
        long retryAfterSeconds = (error.retryAfter().toMillis() + 999) / 1000;
        return new ApiErrorResponse(
                STATUS_ERROR, error.message(), error.code().name(), retryAfterSeconds, error.providerFailures());
    }
}
