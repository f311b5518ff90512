package com.williamcallahan.llmorchestrator.service.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock-guarded slice of the response cache.
 *
 * <p>The backing map is in access order, so iteration starts at the least recently used entry.
 * Only map bookkeeping happens under the lock; compression runs outside it.</p>
 */
final class CacheShard {
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final long maxBytes;
    private long currentBytes;

    CacheShard(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    /**
     * Looks up a live entry, refreshing its recency.
     *
     * @return the entry, or null on miss; an expired entry is removed and reported through {@code expired}
     */
    CacheEntry get(String key, Instant now, Duration ttl, ShardCounters counters) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(now, ttl)) {
                removeEntry(key);
                counters.expired(1);
                return null;
            }
            entry.touch(now);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores an entry, evicting least recently used entries until it fits.
     *
     * @return false when the entry alone exceeds the shard budget and was not stored
     */
    boolean put(CacheEntry entry, ShardCounters counters) {
        if (entry.sizeBytes() > maxBytes) {
            return false;
        }
        lock.lock();
        try {
            removeEntry(entry.key());
            Iterator<Map.Entry<String, CacheEntry>> eldestFirst = entries.entrySet().iterator();
            int evicted = 0;
            while (currentBytes + entry.sizeBytes() > maxBytes && eldestFirst.hasNext()) {
                CacheEntry victim = eldestFirst.next().getValue();
                eldestFirst.remove();
                currentBytes -= victim.sizeBytes();
                evicted++;
            }
            entries.put(entry.key(), entry);
            currentBytes += entry.sizeBytes();
            counters.evicted(evicted);
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean invalidate(String key) {
        lock.lock();
        try {
            return removeEntry(key) != null;
        } finally {
            lock.unlock();
        }
    }

    int removeExpired(Instant now, Duration ttl) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<CacheEntry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                CacheEntry entry = iterator.next();
                if (entry.isExpired(now, ttl)) {
                    iterator.remove();
                    currentBytes -= entry.sizeBytes();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            entries.clear();
            currentBytes = 0;
        } finally {
            lock.unlock();
        }
    }

    /** Adds this shard's per-tier totals to {@code tally}. */
    void tally(TierTally tally) {
        lock.lock();
        try {
            for (CacheEntry entry : entries.values()) {
                tally.add(entry.tier(), entry.sizeBytes());
            }
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            currentBytes -= removed.sizeBytes();
        }
        return removed;
    }

    /** Receives eviction and expiry counts from a shard. */
    interface ShardCounters {
        void evicted(int count);

        void expired(int count);
    }

    /** Mutable accumulator for per-tier statistics. */
    static final class TierTally {
        long memoryEntries;
        long memoryBytes;
        long compressedEntries;
        long compressedBytes;

        void add(StorageTier tier, long bytes) {
            if (tier == StorageTier.MEMORY) {
                memoryEntries++;
                memoryBytes += bytes;
            } else {
                compressedEntries++;
                compressedBytes += bytes;
            }
        }
    }
}
