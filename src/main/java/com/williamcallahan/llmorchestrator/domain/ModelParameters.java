package com.williamcallahan.llmorchestrator.domain;

import java.util.Locale;

/**
 * Generation parameters that affect the determinism of a completion.
 *
 * <p>Every field here participates in the response cache key; anything that does not change
 * the model output (tenant, deadline, request id) must stay out of this record.</p>
 *
 * @param modelId requested model identifier, or {@link #DEFAULT_MODEL} to use each provider's default
 * @param temperature sampling temperature
 * @param maxOutputTokens upper bound on generated tokens, also used for pessimistic cost estimates
 */
public record ModelParameters(String modelId, double temperature, int maxOutputTokens) {
    /** Marker meaning "use the provider's configured model". */
    public static final String DEFAULT_MODEL = "default";

    private static final double MAX_TEMPERATURE = 2.0;

    public ModelParameters {
        modelId = modelId == null || modelId.isBlank() ? DEFAULT_MODEL : modelId.trim();
        if (temperature < 0 || temperature > MAX_TEMPERATURE || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("temperature must be between 0 and " + MAX_TEMPERATURE);
        }
        if (maxOutputTokens <= 0) {
            throw new IllegalArgumentException("maxOutputTokens must be positive");
        }
    }

    /**
     * Returns whether the caller left model selection to the provider.
     */
    public boolean usesProviderDefaultModel() {
        return DEFAULT_MODEL.equals(modelId);
    }

    /**
     * Renders the parameters in a canonical form suitable for hashing.
     */
    public String fingerprint() {
        return String.format(Locale.ROOT, "model=%s;temperature=%.4f;maxOutputTokens=%d",
                modelId, temperature, maxOutputTokens);
    }
}
