package com.williamcallahan.llmorchestrator.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.llmorchestrator.domain.CompletionResponse;
import com.williamcallahan.llmorchestrator.domain.ErrorCode;
import com.williamcallahan.llmorchestrator.domain.OrchestrationError;
import com.williamcallahan.llmorchestrator.domain.OrchestrationResult;
import com.williamcallahan.llmorchestrator.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies single-flight execution of identical concurrent requests.
 */
class RequestCoalescerTest {
    private static final String KEY = "cache-key";
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private MutableClock clock;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-15T12:00:00Z");
        callers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    @Test
    void execute_runsWorkOnceForConcurrentCallers() throws Exception {
        RequestCoalescer coalescer = new RequestCoalescer(WINDOW, clock);
        CountDownLatch leaderStarted = new CountDownLatch(1);
        CountDownLatch releaseLeader = new CountDownLatch(1);
        AtomicInteger executions = new AtomicInteger();
        OrchestrationResult shared = success("shared answer");

        Future<OrchestrationResult> leader = callers.submit(() -> coalescer.execute(KEY, deadline(), () -> {
            executions.incrementAndGet();
            leaderStarted.countDown();
            await(releaseLeader);
            return shared;
        }));
        assertTrue(leaderStarted.await(5, TimeUnit.SECONDS));
        Future<OrchestrationResult> follower = callers.submit(() -> coalescer.execute(KEY, deadline(), () -> {
            executions.incrementAndGet();
            return success("should not run");
        }));
        waitForWaiters(coalescer, 1);
        releaseLeader.countDown();

        assertSame(shared, leader.get(5, TimeUnit.SECONDS));
        assertSame(shared, follower.get(5, TimeUnit.SECONDS));
        assertEquals(1, executions.get());
    }

    @Test
    void execute_reusesSuccessWithinWindow() {
        RequestCoalescer coalescer = new RequestCoalescer(WINDOW, clock);
        OrchestrationResult first = coalescer.execute(KEY, deadline(), () -> success("first"));

        OrchestrationResult second = coalescer.execute(KEY, deadline(), () -> success("second"));

        assertSame(first, second);
        assertEquals(1, coalescer.coalescedWaiters());
    }

    @Test
    void execute_doesNotRetainFailures() {
        RequestCoalescer coalescer = new RequestCoalescer(WINDOW, clock);
        coalescer.execute(KEY, deadline(),
                () -> OrchestrationResult.rejected(OrchestrationError.allProvidersExhausted(List.of())));

        OrchestrationResult retried = coalescer.execute(KEY, deadline(), () -> success("recovered"));

        assertTrue(retried.isSuccess());
        assertEquals(0, coalescer.coalescedWaiters());
    }

    @Test
    void execute_promotesWaiterWhenLeaderIsCancelled() throws Exception {
        RequestCoalescer coalescer = new RequestCoalescer(WINDOW, clock);
        CountDownLatch leaderStarted = new CountDownLatch(1);
        CountDownLatch releaseLeader = new CountDownLatch(1);

        Future<OrchestrationResult> leader = callers.submit(() -> coalescer.execute(KEY, deadline(), () -> {
            leaderStarted.countDown();
            await(releaseLeader);
            return OrchestrationResult.rejected(OrchestrationError.cancelled());
        }));
        assertTrue(leaderStarted.await(5, TimeUnit.SECONDS));
        Future<OrchestrationResult> follower = callers.submit(
                () -> coalescer.execute(KEY, deadline(), () -> success("follower ran it")));
        waitForWaiters(coalescer, 1);
        releaseLeader.countDown();

        assertEquals(ErrorCode.CANCELLED, leader.get(5, TimeUnit.SECONDS).error().orElseThrow().code());
        OrchestrationResult promoted = follower.get(5, TimeUnit.SECONDS);
        assertEquals("follower ran it", promoted.response().orElseThrow().text());
    }

    @Test
    void execute_returnsTimeoutWhenDeadlineAlreadyPassed() throws Exception {
        RequestCoalescer coalescer = new RequestCoalescer(WINDOW, clock);
        CountDownLatch leaderStarted = new CountDownLatch(1);
        CountDownLatch releaseLeader = new CountDownLatch(1);
        Future<OrchestrationResult> leader = callers.submit(() -> coalescer.execute(KEY, deadline(), () -> {
            leaderStarted.countDown();
            await(releaseLeader);
            return success("late");
        }));
        assertTrue(leaderStarted.await(5, TimeUnit.SECONDS));

        OrchestrationResult waited = coalescer.execute(KEY, clock.instant(), () -> success("unused"));
        releaseLeader.countDown();

        assertFalse(waited.isSuccess());
        assertEquals(ErrorCode.TIMEOUT, waited.error().orElseThrow().code());
        assertTrue(leader.get(5, TimeUnit.SECONDS).isSuccess());
    }

    @Test
    void execute_propagatesLeaderExceptionToCaller() {
        RequestCoalescer coalescer = new RequestCoalescer(WINDOW, clock);

        assertThrows(IllegalStateException.class, () -> coalescer.execute(KEY, deadline(), () -> {
            throw new IllegalStateException("codec failure");
        }));
        assertTrue(coalescer.execute(KEY, deadline(), () -> success("next")).isSuccess());
    }

    private Instant deadline() {
        return clock.instant().plus(Duration.ofSeconds(30));
    }

    private static OrchestrationResult success(String text) {
        return OrchestrationResult.completed(new CompletionResponse(
                UUID.randomUUID(), text, "openai", "gpt-4o-mini", 4, false, Duration.ofMillis(25)));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitForWaiters(RequestCoalescer coalescer, long expected) throws InterruptedException {
        long giveUpAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (coalescer.coalescedWaiters() < expected && System.nanoTime() < giveUpAt) {
            Thread.sleep(10);
        }
    }
}
