package com.williamcallahan.llmorchestrator.service.cache;

import java.time.Instant;

/**
 * Completion payload stored in the response cache.
 *
 * @param text generated text
 * @param provider provider that produced the text
 * @param model model that produced the text
 * @param producedAt when the provider returned the text
 */
public record CachedCompletion(String text, String provider, String model, Instant producedAt) {}
