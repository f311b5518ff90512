package com.williamcallahan.llmorchestrator.service.telemetry;

import com.williamcallahan.llmorchestrator.domain.UsageRecord;

/**
 * Fire-and-forget consumer of usage records for audit and billing.
 *
 * <p>Callers never wait for persistence; implementations must return promptly and must not
 * throw for storage failures.</p>
 */
@FunctionalInterface
public interface UsageSink {

    /** Sink that discards everything. */
    UsageSink NOOP = usageRecord -> {};

    void recordUsage(UsageRecord usageRecord);
}
