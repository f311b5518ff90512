package com.williamcallahan.llmorchestrator.domain;

import com.williamcallahan.llmorchestrator.support.PromptHasher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable description of one logical document-generation request.
 *
 * <p>Instances are created by the caller through {@link #builder(String)} and never mutated. The
 * {@code promptHash} covers the normalized prompt and the {@link ModelParameters}; tenant, caller
 * identity and deadline are deliberately excluded so that they never split the response cache.</p>
 *
 * @param id unique request id
 * @param prompt prompt text sent to the provider
 * @param promptHash stable hash of normalized prompt plus parameters
 * @param parameters output-affecting generation parameters
 * @param tenantId owning tenant
 * @param userId calling user, used for per-user rate limiting
 * @param clientIp caller address, used for per-IP rate limiting
 * @param maxCostCents per-request cost ceiling in cents
 * @param deadline absolute instant after which the request is abandoned
 * @param streamRequested whether the caller asked for token streaming
 * @param routingStrategy ranking strategy for this request, null for the router's default
 */
public record CompletionRequest(
        UUID id,
        String prompt,
        String promptHash,
        ModelParameters parameters,
        String tenantId,
        String userId,
        String clientIp,
        long maxCostCents,
        Instant deadline,
        boolean streamRequested,
        RoutingStrategy routingStrategy) {

    public CompletionRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(deadline, "deadline");
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be null or blank");
        }
        if (promptHash == null || promptHash.isBlank()) {
            throw new IllegalArgumentException("promptHash cannot be null or blank");
        }
        if (maxCostCents <= 0) {
            throw new IllegalArgumentException("maxCostCents must be positive");
        }
    }

    /**
     * Starts a builder for the given prompt.
     */
    public static Builder builder(String prompt) {
        return new Builder(prompt);
    }

    /**
     * Fluent builder that computes the prompt hash from the final parameters.
     */
    public static final class Builder {
        private static final int DEFAULT_MAX_OUTPUT_TOKENS = 1024;
        private static final double DEFAULT_TEMPERATURE = 0.7;
        private static final Duration DEFAULT_TIME_BUDGET = Duration.ofSeconds(60);

        private final String prompt;
        private UUID id = UUID.randomUUID();
        private ModelParameters parameters =
                new ModelParameters(ModelParameters.DEFAULT_MODEL, DEFAULT_TEMPERATURE, DEFAULT_MAX_OUTPUT_TOKENS);
        private String tenantId = "default";
        private String userId;
        private String clientIp;
        private long maxCostCents = Long.MAX_VALUE;
        private Instant deadline;
        private boolean streamRequested;
        private RoutingStrategy routingStrategy;
        private Clock clock = Clock.systemUTC();

        private Builder(String prompt) {
            this.prompt = prompt;
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder parameters(ModelParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder maxCostCents(long maxCostCents) {
            this.maxCostCents = maxCostCents;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder streamRequested(boolean streamRequested) {
            this.streamRequested = streamRequested;
            return this;
        }

        public Builder routingStrategy(RoutingStrategy routingStrategy) {
            this.routingStrategy = routingStrategy;
            return this;
        }

        /** Time source for the default deadline when none is set. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Builds the request, hashing the prompt with the chosen parameters. */
        public CompletionRequest build() {
            Objects.requireNonNull(parameters, "parameters");
            String promptHash = PromptHasher.promptHash(prompt, parameters.fingerprint());
            return new CompletionRequest(
                    id,
                    prompt,
                    promptHash,
                    parameters,
                    tenantId,
                    userId,
                    clientIp,
                    maxCostCents,
                    deadline == null ? clock.instant().plus(DEFAULT_TIME_BUDGET) : deadline,
                    streamRequested,
                    routingStrategy);
        }
    }
}
