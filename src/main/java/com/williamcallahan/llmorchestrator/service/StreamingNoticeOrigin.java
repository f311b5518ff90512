package com.williamcallahan.llmorchestrator.service;

/**
 * Identifies where a streaming notice originated in the provider attempt chain.
 *
 * @param provider provider that triggered the notice
 * @param attempt current attempt number (1-based)
 * @param maxAttempts number of ranked candidates for the request
 */
public record StreamingNoticeOrigin(String provider, int attempt, int maxAttempts) {
    public StreamingNoticeOrigin {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive");
        }
        if (maxAttempts <= 0 || attempt > maxAttempts) {
            throw new IllegalArgumentException("attempt must be <= maxAttempts");
        }
        provider = provider == null ? "" : provider;
    }
}
