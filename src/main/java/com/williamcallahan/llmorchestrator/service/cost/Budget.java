package com.williamcallahan.llmorchestrator.service.cost;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Spend counter for one provider in one period window.
 *
 * <p>Mutated only through compare-and-swap: {@link #tryReserve} never lets {@code spentCents}
 * exceed {@code limitCents}, and {@link #refund} never drives it below zero. A new instance
 * replaces this one when the period rolls over; outstanding reservations settle against the
 * instance they were taken from.</p>
 */
final class Budget {
    private final String provider;
    private final BudgetPeriod period;
    private final String periodKey;
    private final long limitCents;
    private final AtomicLong spentCents = new AtomicLong();

    Budget(String provider, BudgetPeriod period, String periodKey, long limitCents) {
        this.provider = provider;
        this.period = period;
        this.periodKey = periodKey;
        this.limitCents = limitCents;
    }

    /**
     * Adds {@code amountCents} when it fits under the limit.
     *
     * @return true when the amount was added
     */
    boolean tryReserve(long amountCents) {
        while (true) {
            long current = spentCents.get();
            if (amountCents > limitCents - current) {
                return false;
            }
            if (spentCents.compareAndSet(current, current + amountCents)) {
                return true;
            }
        }
    }

    /**
     * Adds as much of {@code amountCents} as fits under the limit.
     *
     * @return the amount actually added
     */
    long reserveUpTo(long amountCents) {
        while (true) {
            long current = spentCents.get();
            long granted = Math.max(0L, Math.min(amountCents, limitCents - current));
            if (granted == 0L || spentCents.compareAndSet(current, current + granted)) {
                return granted;
            }
        }
    }

    /** Returns {@code amountCents} to the budget, never going below zero. */
    void refund(long amountCents) {
        spentCents.updateAndGet(current -> Math.max(0L, current - amountCents));
    }

    String provider() {
        return provider;
    }

    BudgetPeriod period() {
        return period;
    }

    String periodKey() {
        return periodKey;
    }

    long limitCents() {
        return limitCents;
    }

    long spentCents() {
        return spentCents.get();
    }

    long remainingCents() {
        return Math.max(0L, limitCents - spentCents.get());
    }
}
