package com.williamcallahan.llmorchestrator.service.cache;

/**
 * Where a cached payload lives.
 */
public enum StorageTier {
    /** Stored as given; used for payloads below the compression threshold. */
    MEMORY,
    /** GZIP-compressed; decompressed transparently on read. */
    COMPRESSED
}
