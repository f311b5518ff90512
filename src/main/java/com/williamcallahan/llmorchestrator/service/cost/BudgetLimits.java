package com.williamcallahan.llmorchestrator.service.cost;

/**
 * Spend limits for one provider.
 *
 * @param dailyLimitCents maximum spend per day in cents
 * @param monthlyLimitCents maximum spend per month in cents
 */
public record BudgetLimits(long dailyLimitCents, long monthlyLimitCents) {
    public BudgetLimits {
        if (dailyLimitCents < 0 || monthlyLimitCents < 0) {
            throw new IllegalArgumentException("budget limits cannot be negative");
        }
    }

    /** Returns the limit for one period. */
    public long limitFor(BudgetPeriod period) {
        return period == BudgetPeriod.DAY ? dailyLimitCents : monthlyLimitCents;
    }
}
