package com.williamcallahan.llmorchestrator.service.history;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded in-memory log of recent provider attempts, newest last.
 *
 * <p>Once {@code capacity} records are held the oldest is dropped. Used for fallback diagnostics
 * only; billing relies on usage records.</p>
 */
public class AttemptHistory {
    private final int capacity;
    private final Clock clock;
    private final Deque<AttemptRecord> records;

    public AttemptHistory(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.records = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void record(AttemptRecord attempt) {
        Objects.requireNonNull(attempt, "attempt");
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(attempt);
    }

    /**
     * Returns attempts recorded within {@code window} of now, oldest first.
     *
     * @param window how far back to look
     * @return matching attempts
     */
    public synchronized List<AttemptRecord> recent(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<AttemptRecord> matching = new ArrayList<>();
        for (AttemptRecord attempt : records) {
            if (!attempt.recordedAt().isBefore(cutoff)) {
                matching.add(attempt);
            }
        }
        return List.copyOf(matching);
    }

    public synchronized int size() {
        return records.size();
    }
}
