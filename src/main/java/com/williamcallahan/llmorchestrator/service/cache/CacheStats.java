package com.williamcallahan.llmorchestrator.service.cache;

/**
 * Snapshot of response-cache activity and occupancy.
 *
 * @param hits lookups served from cache
 * @param misses lookups that found nothing
 * @param evictions entries dropped to respect the byte budget
 * @param expirations entries dropped because their TTL passed
 * @param memoryEntries entries in the uncompressed tier
 * @param memoryBytes bytes held by the uncompressed tier
 * @param compressedEntries entries in the compressed tier
 * @param compressedBytes bytes held by the compressed tier
 */
public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long expirations,
        long memoryEntries,
        long memoryBytes,
        long compressedEntries,
        long compressedBytes) {

    /** Fraction of lookups that hit, zero before the first lookup. */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public long totalEntries() {
        return memoryEntries + compressedEntries;
    }

    public long totalBytes() {
        return memoryBytes + compressedBytes;
    }
}
