package com.williamcallahan.llmorchestrator.domain.errors;

import com.williamcallahan.llmorchestrator.domain.CompletionResponse;

/**
 * JSON payload of a served completion.
 *
 * @param status fixed status indicator ("success")
 * @param requestId id of the request
 * @param text generated text
 * @param provider provider that produced the text
 * @param model model reported by the provider
 * @param costCents cents charged to this request
 * @param cacheHit whether the text came from the response cache
 * @param latencyMillis time spent serving the request
 */
public record ApiCompletionResponse(
        String status,
        String requestId,
        String text,
        String provider,
        String model,
        long costCents,
        boolean cacheHit,
        long latencyMillis) implements ApiResponse {

    public static ApiCompletionResponse from(CompletionResponse response) {
        return new ApiCompletionResponse(
                "success",
                response.requestId().toString(),
                response.text(),
                response.provider(),
                response.model(),
                response.costCents(),
                response.cacheHit(),
                response.latency().toMillis());
    }
}
