package com.williamcallahan.llmorchestrator.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one orchestrated request: either a response or a structured terminal error.
 */
public sealed interface OrchestrationResult permits OrchestrationResult.Completed, OrchestrationResult.Rejected {

    static OrchestrationResult completed(CompletionResponse response) {
        return new Completed(response);
    }

    static OrchestrationResult rejected(OrchestrationError error) {
        return new Rejected(error);
    }

    /** Returns the response when this result is a success. */
    default Optional<CompletionResponse> response() {
        return this instanceof Completed completed ? Optional.of(completed.value()) : Optional.empty();
    }

    /** Returns the error when this result is a failure. */
    default Optional<OrchestrationError> error() {
        return this instanceof Rejected rejected ? Optional.of(rejected.value()) : Optional.empty();
    }

    default boolean isSuccess() {
        return this instanceof Completed;
    }

    /**
     * Successful result.
     *
     * @param value produced response
     */
    record Completed(CompletionResponse value) implements OrchestrationResult {
        public Completed {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Terminal failure.
     *
     * @param value structured error
     */
    record Rejected(OrchestrationError value) implements OrchestrationResult {
        public Rejected {
            Objects.requireNonNull(value, "value");
        }
    }
}
