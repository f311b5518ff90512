package com.williamcallahan.llmorchestrator.service.cost;

import java.util.Objects;

/**
 * Outcome of {@link CostLedger#reserve}.
 */
public sealed interface ReservationResult permits ReservationResult.Reserved, ReservationResult.Rejected {

    /**
     * Budget was reserved; settle the token after the call.
     *
     * @param token reservation handle
     */
    record Reserved(ReservationToken token) implements ReservationResult {
        public Reserved {
            Objects.requireNonNull(token, "token");
        }
    }

    /**
     * Reservation would exceed a limit.
     *
     * @param provider provider whose budget refused
     * @param period tightest window that refused
     * @param limitCents limit of that window
     * @param spentCents spend already committed or reserved in that window
     * @param requestedCents amount requested
     */
    record Rejected(String provider, BudgetPeriod period, long limitCents, long spentCents, long requestedCents)
            implements ReservationResult {

        /** Short diagnostic without prompt data. */
        public String describe() {
            return period.name().toLowerCase(java.util.Locale.ROOT) + " budget exhausted (" + spentCents + "+"
                    + requestedCents + " > " + limitCents + " cents)";
        }
    }
}
