package com.williamcallahan.llmorchestrator.config;

import com.williamcallahan.llmorchestrator.service.cache.ResponseCache;
import com.williamcallahan.llmorchestrator.service.cost.CostLedger;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodic housekeeping: expired cache entries and budget period rollover.
 *
 * <p>Both also happen lazily on access, so a missed run only delays reclamation.</p>
 */
@Configuration
@EnableScheduling
public class MaintenanceScheduler {
    private final ResponseCache responseCache;
    private final CostLedger costLedger;

    public MaintenanceScheduler(ResponseCache responseCache, CostLedger costLedger) {
        this.responseCache = responseCache;
        this.costLedger = costLedger;
    }

    @Scheduled(fixedDelayString = "${orchestrator.cache.sweep-interval:PT5M}")
    public void sweepExpiredCacheEntries() {
        responseCache.sweepExpired();
    }

    @Scheduled(fixedDelayString = "${orchestrator.budget.rollover-interval:PT1M}")
    public void rolloverBudgets() {
        costLedger.rollover();
    }
}
