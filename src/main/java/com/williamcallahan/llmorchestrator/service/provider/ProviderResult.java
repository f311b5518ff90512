package com.williamcallahan.llmorchestrator.service.provider;

import java.util.Objects;

/**
 * Result of one provider call, carrying an error category instead of throwing.
 */
public sealed interface ProviderResult permits ProviderResult.Success, ProviderResult.Failure {

    static ProviderResult success(ModelResponse response) {
        return new Success(response);
    }

    static ProviderResult failure(ProviderErrorCategory category, String message) {
        return new Failure(category, message);
    }

    /**
     * Provider produced a response.
     *
     * @param response model response
     */
    record Success(ModelResponse response) implements ProviderResult {
        public Success {
            Objects.requireNonNull(response, "response");
        }
    }

    /**
     * Provider call failed.
     *
     * @param category classification used for fallback and breaker decisions
     * @param message short diagnostic message
     */
    record Failure(ProviderErrorCategory category, String message) implements ProviderResult {
        public Failure {
            Objects.requireNonNull(category, "category");
            message = message == null ? "" : message;
        }
    }
}
