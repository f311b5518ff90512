package com.williamcallahan.llmorchestrator.service.cache;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.support.PromptHasher;

/**
 * Derives response-cache keys from requests.
 *
 * <p>The key covers the prompt hash and every output-affecting parameter. Tenant, caller
 * identity, cost ceiling and deadline are excluded, so requests that differ only there share
 * an entry.</p>
 */
public final class ResponseCacheKeys {
    private static final String KEY_NAMESPACE = "completion:v1";

    private ResponseCacheKeys() {}

    public static String forRequest(CompletionRequest request) {
        return PromptHasher.hashParts(KEY_NAMESPACE, request.promptHash(), request.parameters().fingerprint());
    }
}
