package com.williamcallahan.llmorchestrator.service.cost;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one outstanding budget reservation.
 *
 * <p>A token settles exactly once, by {@link CostLedger#commit} or {@link CostLedger#release};
 * later settlement attempts are ignored.</p>
 */
public final class ReservationToken {
    private final UUID id = UUID.randomUUID();
    private final String provider;
    private final long estimatedCents;
    private final Budget dailyBudget;
    private final Budget monthlyBudget;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    ReservationToken(String provider, long estimatedCents, Budget dailyBudget, Budget monthlyBudget) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.estimatedCents = estimatedCents;
        this.dailyBudget = Objects.requireNonNull(dailyBudget, "dailyBudget");
        this.monthlyBudget = Objects.requireNonNull(monthlyBudget, "monthlyBudget");
    }

    public UUID id() {
        return id;
    }

    public String provider() {
        return provider;
    }

    public long estimatedCents() {
        return estimatedCents;
    }

    public boolean isSettled() {
        return settled.get();
    }

    boolean markSettled() {
        return settled.compareAndSet(false, true);
    }

    Budget dailyBudget() {
        return dailyBudget;
    }

    Budget monthlyBudget() {
        return monthlyBudget;
    }

    @Override
    public String toString() {
        return "ReservationToken[" + id + ", provider=" + provider + ", estimatedCents=" + estimatedCents + "]";
    }
}
