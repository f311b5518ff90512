package com.williamcallahan.llmorchestrator.service;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.llmorchestrator.domain.ErrorCode;
import com.williamcallahan.llmorchestrator.domain.OrchestrationError;
import com.williamcallahan.llmorchestrator.domain.OrchestrationResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges concurrent requests with the same cache key into one upstream execution.
 *
 * <p>The first caller for a key becomes the leader and runs the work on its own thread; later
 * callers wait on the leader's result. A successful result stays joinable for the configured
 * window after completion. Failures reach only the waiters already attached and are removed
 * immediately. When the leader's caller cancels, the waiters are released to retry and one of
 * them becomes the new leader.</p>
 */
public class RequestCoalescer {
    private static final Logger log = LoggerFactory.getLogger(RequestCoalescer.class);

    private final AsyncCache<String, OrchestrationResult> sharedResults;
    private final Clock clock;
    private final LongAdder coalescedWaiters = new LongAdder();

    public RequestCoalescer(Duration window, Clock clock) {
        Objects.requireNonNull(window, "window");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sharedResults = Caffeine.newBuilder()
                .expireAfterWrite(window.isZero() ? Duration.ofNanos(1) : window)
                .buildAsync();
    }

    /**
     * Runs {@code work} once per key among concurrent callers.
     *
     * @param key coalescing key, the response-cache key
     * @param deadline how long a waiter is willing to wait
     * @param work upstream execution, run on the calling thread when this caller leads
     * @return the leader's result; waiters receive the same instance
     */
    public OrchestrationResult execute(String key, Instant deadline, Supplier<OrchestrationResult> work) {
        while (true) {
            CompletableFuture<OrchestrationResult> promise = new CompletableFuture<>();
            CompletableFuture<OrchestrationResult> existing = sharedResults.asMap().putIfAbsent(key, promise);
            if (existing == null) {
                return lead(key, promise, work);
            }
            coalescedWaiters.increment();
            try {
                long waitMillis = Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
                return existing.get(waitMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException waitedTooLong) {
                return OrchestrationResult.rejected(OrchestrationError.timeout(List.of()));
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                return OrchestrationResult.rejected(OrchestrationError.cancelled());
            } catch (ExecutionException leaderFailed) {
                log.debug("Coalesced leader did not produce a result, retrying (cause={})",
                        leaderFailed.getCause().getClass().getSimpleName());
            }
        }
    }

    /** Number of callers that waited on another caller's execution. */
    public long coalescedWaiters() {
        return coalescedWaiters.sum();
    }

    private OrchestrationResult lead(
            String key, CompletableFuture<OrchestrationResult> promise, Supplier<OrchestrationResult> work) {
        OrchestrationResult result;
        try {
            result = work.get();
        } catch (RuntimeException failure) {
            sharedResults.asMap().remove(key, promise);
            promise.completeExceptionally(failure);
            throw failure;
        }
        if (result.error().map(error -> error.code() == ErrorCode.CANCELLED).orElse(false)) {
            sharedResults.asMap().remove(key, promise);
            promise.completeExceptionally(new LeaderCancelledException());
            return result;
        }
        if (!result.isSuccess()) {
            sharedResults.asMap().remove(key, promise);
        }
        promise.complete(result);
        return result;
    }

    /** Signals waiters that the leader's caller went away before a result existed. */
    static final class LeaderCancelledException extends RuntimeException {
        LeaderCancelledException() {
            super("coalescing leader cancelled", null, false, false);
        }
    }
}
