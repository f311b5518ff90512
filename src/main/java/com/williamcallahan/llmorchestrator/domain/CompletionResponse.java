package com.williamcallahan.llmorchestrator.domain;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Successful outcome of one logical request.
 *
 * @param requestId id of the originating request
 * @param text generated text
 * @param provider provider that produced the text (the original producer on cache hits)
 * @param model model reported by the provider
 * @param costCents cost charged to this request; zero on cache hits and coalesced followers
 * @param cacheHit whether the text came from the response cache
 * @param latency wall time spent serving the request
 */
public record CompletionResponse(
        UUID requestId, String text, String provider, String model, long costCents, boolean cacheHit, Duration latency) {
    public CompletionResponse {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(provider, "provider");
        model = model == null ? "" : model;
        latency = latency == null ? Duration.ZERO : latency;
        if (costCents < 0) {
            throw new IllegalArgumentException("costCents cannot be negative");
        }
    }

    /**
     * Returns a copy attributed to another request that shared this result.
     */
    public CompletionResponse sharedWith(UUID otherRequestId, Duration otherLatency) {
        return new CompletionResponse(otherRequestId, text, provider, model, 0L, cacheHit, otherLatency);
    }
}
