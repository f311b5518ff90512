package com.williamcallahan.llmorchestrator.service.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and expiry for {@link ResponseCache}.
 *
 * @param maxBytes total byte budget across all shards
 * @param shardCount number of independently locked shards
 * @param compressionThresholdBytes payloads at or above this size are stored compressed
 * @param ttl maximum age of an entry, independent of LRU pressure
 */
public record ResponseCacheSettings(long maxBytes, int shardCount, int compressionThresholdBytes, Duration ttl) {
    public ResponseCacheSettings {
        Objects.requireNonNull(ttl, "ttl");
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be positive");
        }
        if (compressionThresholdBytes <= 0) {
            throw new IllegalArgumentException("compressionThresholdBytes must be positive");
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }
}
