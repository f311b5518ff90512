package com.williamcallahan.llmorchestrator.service.provider;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;

/**
 * Provider-neutral completion call.
 *
 * @param prompt prompt text
 * @param model concrete model id resolved for the target provider
 * @param temperature sampling temperature
 * @param maxOutputTokens generation cap
 */
public record ModelRequest(String prompt, String model, double temperature, int maxOutputTokens) {
    public ModelRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be null or blank");
        }
        model = model == null ? "" : model;
    }

    /**
     * Resolves a request for one provider, substituting the provider's default model when the
     * request leaves the model open.
     */
    public static ModelRequest forProvider(CompletionRequest request, ProviderDescriptor descriptor) {
        String model = request.parameters().usesProviderDefaultModel()
                ? descriptor.defaultModel()
                : request.parameters().modelId();
        return new ModelRequest(
                request.prompt(), model, request.parameters().temperature(), request.parameters().maxOutputTokens());
    }
}
