package com.williamcallahan.llmorchestrator.service.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached payload. The stored bytes are never mutated; a re-fetch replaces the entry.
 */
final class CacheEntry {
    private final String key;
    private final byte[] storedPayload;
    private final StorageTier tier;
    private final int originalSizeBytes;
    private final Instant createdAt;
    private volatile Instant lastAccessAt;

    CacheEntry(String key, byte[] storedPayload, StorageTier tier, int originalSizeBytes, Instant createdAt) {
        this.key = key;
        this.storedPayload = storedPayload;
        this.tier = tier;
        this.originalSizeBytes = originalSizeBytes;
        this.createdAt = createdAt;
        this.lastAccessAt = createdAt;
    }

    String key() {
        return key;
    }

    byte[] storedPayload() {
        return storedPayload;
    }

    StorageTier tier() {
        return tier;
    }

    /** Bytes charged against the cache budget. */
    int sizeBytes() {
        return storedPayload.length;
    }

    int originalSizeBytes() {
        return originalSizeBytes;
    }

    Instant createdAt() {
        return createdAt;
    }

    Instant lastAccessAt() {
        return lastAccessAt;
    }

    void touch(Instant now) {
        lastAccessAt = now;
    }

    boolean isExpired(Instant now, Duration ttl) {
        return !createdAt.plus(ttl).isAfter(now);
    }
}
