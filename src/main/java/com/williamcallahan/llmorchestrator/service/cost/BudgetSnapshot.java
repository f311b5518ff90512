package com.williamcallahan.llmorchestrator.service.cost;

/**
 * Point-in-time view of one provider budget window.
 *
 * @param provider provider name
 * @param period window type
 * @param periodKey window identifier
 * @param limitCents configured limit
 * @param spentCents committed plus outstanding reservations
 * @param remainingCents headroom left
 */
public record BudgetSnapshot(
        String provider, BudgetPeriod period, String periodKey, long limitCents, long spentCents, long remainingCents) {

    static BudgetSnapshot of(Budget budget) {
        return new BudgetSnapshot(
                budget.provider(),
                budget.period(),
                budget.periodKey(),
                budget.limitCents(),
                budget.spentCents(),
                budget.remainingCents());
    }

    /** Fraction of the limit already used, 1.0 when the limit is zero. */
    public double utilization() {
        return limitCents == 0 ? 1.0 : (double) spentCents / limitCents;
    }
}
