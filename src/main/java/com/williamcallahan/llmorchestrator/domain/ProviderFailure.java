package com.williamcallahan.llmorchestrator.domain;

import java.util.Objects;

/**
 * Diagnostic entry describing why one provider was skipped or failed.
 *
 * @param provider provider name
 * @param reason failure classification
 * @param detail short human-readable detail, never containing prompt text
 */
public record ProviderFailure(String provider, FailureReason reason, String detail) {
    public ProviderFailure {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(reason, "reason");
        detail = detail == null ? "" : detail;
    }
}
