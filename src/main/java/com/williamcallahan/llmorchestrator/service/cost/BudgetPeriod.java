package com.williamcallahan.llmorchestrator.service.cost;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Accounting windows enforced by the cost ledger.
 */
public enum BudgetPeriod {
    DAY(DateTimeFormatter.ISO_LOCAL_DATE),
    MONTH(DateTimeFormatter.ofPattern("yyyy-MM"));

    private final DateTimeFormatter keyFormat;

    BudgetPeriod(DateTimeFormatter keyFormat) {
        this.keyFormat = keyFormat;
    }

    /**
     * Returns the identifier of the window containing the given date, for example
     * {@code 2026-10-19} for a day or {@code 2026-10} for a month.
     */
    public String periodKey(LocalDate date) {
        return keyFormat.format(date);
    }
}
