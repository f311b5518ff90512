package com.williamcallahan.llmorchestrator.web;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.ModelParameters;
import com.williamcallahan.llmorchestrator.domain.RoutingStrategy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.Duration;

/**
 * Request body of the completion endpoints. Optional fields fall back to server defaults.
 *
 * @param prompt prompt text
 * @param model model id, omitted to use each provider's default
 * @param temperature sampling temperature
 * @param maxOutputTokens generation limit
 * @param userId calling user for per-user rate limits
 * @param tenantId owning tenant
 * @param maxCostCents per-request cost ceiling
 * @param timeoutMillis time budget from receipt to deadline
 * @param routingStrategy candidate ranking for this request, omitted for the configured default
 */
public record CompletionRequestBody(
        @NotBlank String prompt,
        String model,
        @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
        @Positive Integer maxOutputTokens,
        String userId,
        String tenantId,
        @Positive Long maxCostCents,
        @Positive Long timeoutMillis,
        RoutingStrategy routingStrategy) {

    private static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int DEFAULT_MAX_OUTPUT_TOKENS = 1024;
    private static final long DEFAULT_TIMEOUT_MILLIS = 60_000L;

    /**
     * Builds the domain request; the deadline is measured from now on {@code clock}.
     */
    CompletionRequest toCompletionRequest(String clientIp, boolean streaming, Clock clock) {
        ModelParameters parameters = new ModelParameters(
                model,
                temperature == null ? DEFAULT_TEMPERATURE : temperature,
                maxOutputTokens == null ? DEFAULT_MAX_OUTPUT_TOKENS : maxOutputTokens);
        CompletionRequest.Builder builder = CompletionRequest.builder(prompt)
                .parameters(parameters)
                .userId(userId)
                .clientIp(clientIp)
                .streamRequested(streaming)
                .routingStrategy(routingStrategy)
                .deadline(clock.instant().plus(Duration.ofMillis(timeoutMillis == null ? DEFAULT_TIMEOUT_MILLIS : timeoutMillis)));
        if (tenantId != null && !tenantId.isBlank()) {
            builder.tenantId(tenantId);
        }
        if (maxCostCents != null) {
            builder.maxCostCents(maxCostCents);
        }
        return builder.build();
    }
}
