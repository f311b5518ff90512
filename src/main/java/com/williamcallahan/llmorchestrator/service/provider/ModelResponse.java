package com.williamcallahan.llmorchestrator.service.provider;

import java.util.Objects;

/**
 * Provider response with the usage figures needed for cost settlement.
 *
 * @param text generated text
 * @param model model that served the request
 * @param promptTokens prompt tokens billed, or -1 when the provider did not report usage
 * @param completionTokens completion tokens billed, or -1 when the provider did not report usage
 */
public record ModelResponse(String text, String model, long promptTokens, long completionTokens) {
    /** Marker for usage the provider did not report. */
    public static final long UNREPORTED = -1L;

    public ModelResponse {
        Objects.requireNonNull(text, "text");
        model = model == null ? "" : model;
    }

    /** Returns whether the provider reported token usage. */
    public boolean hasReportedUsage() {
        return promptTokens >= 0 && completionTokens >= 0;
    }
}
