package com.williamcallahan.llmorchestrator.service.cache;

import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricsSink;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact-key, two-tier, sharded LRU cache of completion payloads.
 *
 * <p>Keys are spread across shards by hash; each shard is guarded by its own lock and holds an
 * equal share of the byte budget. Payloads below the compression threshold are kept as given,
 * larger ones are GZIP-compressed on {@link #put} and decompressed on {@link #get}. Entries
 * older than the TTL are dropped lazily on lookup and eagerly by {@link #sweepExpired()}.</p>
 */
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final CacheShard[] shards;
    private final ResponseCacheSettings settings;
    private final Clock clock;
    private final MetricsSink metricsSink;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private final CacheShard.ShardCounters shardCounters = new CacheShard.ShardCounters() {
        @Override
        public void evicted(int count) {
            evictions.add(count);
        }

        @Override
        public void expired(int count) {
            expirations.add(count);
        }
    };

    public ResponseCache(ResponseCacheSettings settings, Clock clock, MetricsSink metricsSink) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink");
        long bytesPerShard = Math.max(1L, settings.maxBytes() / settings.shardCount());
        this.shards = new CacheShard[settings.shardCount()];
        for (int index = 0; index < shards.length; index++) {
            shards[index] = new CacheShard(bytesPerShard);
        }
    }

    /**
     * Returns the payload stored under {@code key}, refreshing its recency on hit.
     *
     * @param key cache key from {@link ResponseCacheKeys}
     * @return a copy of the stored payload, or empty on miss
     */
    public Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key");
        CacheEntry entry = shardFor(key).get(key, clock.instant(), settings.ttl(), shardCounters);
        if (entry == null) {
            misses.increment();
            metricsSink.emit(MetricNames.CACHE_LOOKUP, 0, Map.of(MetricNames.TAG_OUTCOME, "miss"));
            return Optional.empty();
        }
        hits.increment();
        metricsSink.emit(MetricNames.CACHE_LOOKUP, 1, Map.of(MetricNames.TAG_OUTCOME, "hit"));
        byte[] stored = entry.storedPayload();
        if (entry.tier() == StorageTier.COMPRESSED) {
            return Optional.of(PayloadCompressor.decompress(stored));
        }
        return Optional.of(stored.clone());
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous entry.
     *
     * @param key cache key from {@link ResponseCacheKeys}
     * @param value payload bytes; the cache keeps its own copy
     * @return false when the payload is too large for a shard and was not cached
     */
    public boolean put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        StorageTier tier = value.length >= settings.compressionThresholdBytes()
                ? StorageTier.COMPRESSED
                : StorageTier.MEMORY;
        byte[] stored = tier == StorageTier.COMPRESSED ? PayloadCompressor.compress(value) : value.clone();
        CacheEntry entry = new CacheEntry(key, stored, tier, value.length, clock.instant());
        boolean accepted = shardFor(key).put(entry, shardCounters);
        if (!accepted) {
            log.debug("Payload exceeds shard budget and was not cached (sizeBytes={})", stored.length);
        }
        return accepted;
    }

    /** Removes one entry. */
    public boolean invalidate(String key) {
        return shardFor(key).invalidate(key);
    }

    /** Removes every entry; statistics are kept. */
    public void clear() {
        for (CacheShard shard : shards) {
            shard.clear();
        }
    }

    /**
     * Drops every entry past its TTL.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheShard shard : shards) {
            removed += shard.removeExpired(now, settings.ttl());
        }
        if (removed > 0) {
            expirations.add(removed);
            log.debug("Cache sweep expired {} entries", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        CacheShard.TierTally tally = new CacheShard.TierTally();
        for (CacheShard shard : shards) {
            shard.tally(tally);
        }
        return new CacheStats(
                hits.sum(),
                misses.sum(),
                evictions.sum(),
                expirations.sum(),
                tally.memoryEntries,
                tally.memoryBytes,
                tally.compressedEntries,
                tally.compressedBytes);
    }

    private CacheShard shardFor(String key) {
        return shards[Math.floorMod(key.hashCode(), shards.length)];
    }
}
