package com.williamcallahan.llmorchestrator.service.cost;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import com.williamcallahan.llmorchestrator.support.MutableClock;
import com.williamcallahan.llmorchestrator.support.RecordingMetricsSink;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies pessimistic reservations, settlement and period rollover of the cost ledger.
 */
class CostLedgerTest {

    private static final String PROVIDER = "openai";
    private static final long DAILY_LIMIT = 100L;
    private static final long MONTHLY_LIMIT = 1_000L;

    private MutableClock clock;
    private RecordingMetricsSink metrics;
    private CostLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-15T12:00:00Z");
        metrics = new RecordingMetricsSink();
        ledger = ledgerWith(new BudgetLimits(DAILY_LIMIT, MONTHLY_LIMIT));
    }

    @Test
    void reserve_holdsEstimateUntilSettled() {
        ReservationToken token = reserved(40);

        assertEquals(60, ledger.remainingCents(PROVIDER));
        assertFalse(token.isSettled());
    }

    @Test
    void reserve_refusesWhenDailyWindowWouldBeExceeded() {
        reserved(90);

        ReservationResult result = ledger.reserve(PROVIDER, 20);

        ReservationResult.Rejected rejected = assertInstanceOf(ReservationResult.Rejected.class, result);
        assertEquals(BudgetPeriod.DAY, rejected.period());
        assertEquals(90, rejected.spentCents());
        assertEquals(10, ledger.remainingCents(PROVIDER));
    }

    @Test
    void reserve_reportsMonthlyWindowWhenItIsTighter() {
        ledger = ledgerWith(new BudgetLimits(DAILY_LIMIT, 30L));

        ReservationResult result = ledger.reserve(PROVIDER, 50);

        ReservationResult.Rejected rejected = assertInstanceOf(ReservationResult.Rejected.class, result);
        assertEquals(BudgetPeriod.MONTH, rejected.period());
        assertEquals(30, ledger.remainingCents(PROVIDER));
    }

    @Test
    void reserve_rejectsUnknownProviderAndNegativeEstimate() {
        assertThrows(IllegalArgumentException.class, () -> ledger.reserve("unknown", 1));
        assertThrows(IllegalArgumentException.class, () -> ledger.reserve(PROVIDER, -1));
    }

    @Test
    void commit_refundsDifferenceWhenActualIsBelowEstimate() {
        ReservationToken token = reserved(40);

        long charged = ledger.commit(token, 15);

        assertEquals(15, charged);
        assertEquals(85, ledger.remainingCents(PROVIDER));
        assertTrue(token.isSettled());
    }

    @Test
    void commit_clampsOverrunToRemainingHeadroom() {
        ReservationToken token = reserved(80);

        long charged = ledger.commit(token, 130);

        assertEquals(100, charged);
        assertEquals(0, ledger.remainingCents(PROVIDER));
        assertEquals(30, ledger.unbilledOverrunCents());
        assertEquals(1, metrics.count(MetricNames.BUDGET_OVERRUN));
    }

    @Test
    void commit_isIgnoredForAlreadySettledToken() {
        ReservationToken token = reserved(40);
        ledger.commit(token, 40);

        long second = ledger.commit(token, 40);
        ledger.release(token);

        assertEquals(0, second);
        assertEquals(60, ledger.remainingCents(PROVIDER));
    }

    @Test
    void release_refundsEntireReservationOnce() {
        ReservationToken token = reserved(40);

        ledger.release(token);
        ledger.release(token);

        assertEquals(DAILY_LIMIT, ledger.remainingCents(PROVIDER));
        assertEquals(1.0, ledger.headroomRatio(PROVIDER), 1e-9);
    }

    @Test
    void reserve_startsFreshDailyWindowAfterMidnightButKeepsMonth() {
        ReservationToken token = reserved(90);
        ledger.commit(token, 90);

        clock.set(Instant.parse("2025-03-16T00:00:01Z"));

        assertEquals(0, ledger.snapshot(PROVIDER).get(0).spentCents());
        assertEquals(90, ledger.snapshot(PROVIDER).get(1).spentCents());
        assertInstanceOf(ReservationResult.Reserved.class, ledger.reserve(PROVIDER, 90));
    }

    @Test
    void rollover_replacesStaleWindowsOnly() {
        ledger.commit(reserved(10), 10);

        assertEquals(0, ledger.rollover());
        clock.set(Instant.parse("2025-04-01T00:00:00Z"));

        assertEquals(2, ledger.rollover());
        assertEquals(0, ledger.rollover());
        List<BudgetSnapshot> snapshots = ledger.snapshot(PROVIDER);
        assertEquals("2025-04-01", snapshots.get(0).periodKey());
        assertEquals("2025-04", snapshots.get(1).periodKey());
        assertEquals(0, snapshots.get(1).spentCents());
    }

    @Test
    void afterMutation_warnsOncePerWindowWhenThresholdCrossed() {
        ledger.commit(reserved(85), 85);
        ledger.commit(reserved(5), 5);

        assertEquals(1, metrics.named(MetricNames.BUDGET_WARNING).stream()
                .filter(emission -> "day".equals(emission.tags().get(MetricNames.TAG_PERIOD)))
                .count());
    }

    @Test
    void snapshots_listsBothWindowsPerProviderInNameOrder() {
        ledger = new CostLedger(
                Map.of("b-provider", new BudgetLimits(10, 20), "a-provider", new BudgetLimits(10, 20)),
                clock,
                ZoneOffset.UTC,
                0.8,
                metrics);

        List<BudgetSnapshot> snapshots = ledger.snapshots();

        assertEquals(4, snapshots.size());
        assertEquals("a-provider", snapshots.get(0).provider());
        assertEquals("b-provider", snapshots.get(3).provider());
    }

    @Test
    void reserve_concurrentCallersNeverOverspend() throws Exception {
        int callers = 8;
        int attemptsPerCaller = 200;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Long>> results = new ArrayList<>();
            for (int caller = 0; caller < callers; caller++) {
                results.add(pool.submit(() -> {
                    start.await();
                    long committed = 0;
                    for (int attempt = 0; attempt < attemptsPerCaller; attempt++) {
                        ThreadLocalRandom random = ThreadLocalRandom.current();
                        long estimate = 1 + random.nextInt(7);
                        ReservationResult result = ledger.reserve(PROVIDER, estimate);
                        if (result instanceof ReservationResult.Reserved reserved) {
                            assertTrue(ledger.remainingCents(PROVIDER) >= 0);
                            if (random.nextBoolean()) {
                                committed += ledger.commit(reserved.token(), random.nextLong(estimate + 1));
                            } else {
                                ledger.release(reserved.token());
                            }
                        }
                    }
                    return committed;
                }));
            }
            start.countDown();
            long totalCommitted = 0;
            for (Future<Long> result : results) {
                totalCommitted += result.get(10, TimeUnit.SECONDS);
            }

            BudgetSnapshot daily = ledger.snapshot(PROVIDER).get(0);
            assertTrue(daily.spentCents() <= DAILY_LIMIT);
            assertEquals(totalCommitted, daily.spentCents());
            assertEquals(0, ledger.unbilledOverrunCents());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void constructor_rejectsWarningRatioOutsideRange() {
        Map<String, BudgetLimits> limits = Map.of(PROVIDER, new BudgetLimits(1, 1));

        assertThrows(IllegalArgumentException.class,
                () -> new CostLedger(limits, clock, ZoneOffset.UTC, 0.0, metrics));
        assertThrows(IllegalArgumentException.class,
                () -> new CostLedger(limits, clock, ZoneOffset.UTC, 1.5, metrics));
    }

    @Test
    void headroomRatio_isZeroForZeroLimit() {
        ledger = ledgerWith(new BudgetLimits(0, 0));

        assertEquals(0.0, ledger.headroomRatio(PROVIDER), 1e-9);
        assertInstanceOf(ReservationResult.Rejected.class, ledger.reserve(PROVIDER, 1));
        clock.advance(Duration.ofDays(1));
        assertInstanceOf(ReservationResult.Reserved.class, ledger.reserve(PROVIDER, 0));
    }

    private CostLedger ledgerWith(BudgetLimits limits) {
        return new CostLedger(Map.of(PROVIDER, limits), clock, ZoneOffset.UTC, 0.8, metrics);
    }

    private ReservationToken reserved(long estimateCents) {
        ReservationResult result = ledger.reserve(PROVIDER, estimateCents);
        return assertInstanceOf(ReservationResult.Reserved.class, result).token();
    }
}
