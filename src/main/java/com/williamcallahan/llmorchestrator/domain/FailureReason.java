package com.williamcallahan.llmorchestrator.domain;

/**
 * Why a single candidate provider did not serve a request.
 */
public enum FailureReason {
    PROVIDER_UNAVAILABLE(false),
    AT_CAPACITY(false),
    RATE_LIMITED(false),
    BUDGET_EXCEEDED(true),
    COST_CEILING_EXCEEDED(true),
    TIMEOUT(false),
    SERVER_ERROR(false),
    AUTH_ERROR(false),
    INVALID_REQUEST(false),
    DEADLINE_EXCEEDED(false);

    private final boolean budgetRelated;

    FailureReason(boolean budgetRelated) {
        this.budgetRelated = budgetRelated;
    }

    /**
     * Returns whether this reason stems from spend limits rather than provider health.
     */
    public boolean isBudgetRelated() {
        return budgetRelated;
    }
}
