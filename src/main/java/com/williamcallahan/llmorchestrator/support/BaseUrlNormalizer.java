package com.williamcallahan.llmorchestrator.support;

/**
 * Normalizes provider base URLs for the OpenAI Java SDK.
 *
 * <p>The SDK appends resource paths such as {@code /chat/completions} to the base URL, so the
 * configured value must end at the API version segment. OpenAI-compatible endpoints of other
 * vendors use different version segments ({@code /v1beta/openai} for Gemini, {@code /v1} for
 * Anthropic and Ollama); those are kept as configured.</p>
 */
public final class BaseUrlNormalizer {
    private static final String CHAT_COMPLETIONS_SUFFIX = "/chat/completions";

    private BaseUrlNormalizer() {}

    /**
     * Normalizes a configured base URL.
     *
     * @param baseUrl raw base URL from configuration
     * @return URL suitable for {@code OpenAIOkHttpClient.builder().baseUrl()}
     * @throws IllegalStateException if baseUrl is null or blank
     */
    public static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Provider base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(CHAT_COMPLETIONS_SUFFIX)) {
            trimmed = trimmed.substring(0, trimmed.length() - CHAT_COMPLETIONS_SUFFIX.length());
        }
        if (trimmed.endsWith("/openai") || trimmed.matches(".*/v\\d+[a-z0-9]*$")) {
            return trimmed;
        }
        return trimmed + "/v1";
    }
}
