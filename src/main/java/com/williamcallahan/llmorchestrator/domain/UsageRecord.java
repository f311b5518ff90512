package com.williamcallahan.llmorchestrator.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit/billing record emitted for every served request.
 *
 * @param requestId originating request id
 * @param provider provider charged, or the producing provider on cache hits
 * @param costCents cost charged in cents
 * @param timestamp when the request was served
 * @param cacheHit whether the response came from cache
 */
public record UsageRecord(UUID requestId, String provider, long costCents, Instant timestamp, boolean cacheHit) {
    public UsageRecord {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
