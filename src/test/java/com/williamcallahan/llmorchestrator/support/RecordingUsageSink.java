package com.williamcallahan.llmorchestrator.support;

import com.williamcallahan.llmorchestrator.domain.UsageRecord;
import com.williamcallahan.llmorchestrator.service.telemetry.UsageSink;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Usage sink that keeps records in memory.
 */
public final class RecordingUsageSink implements UsageSink {
    private final List<UsageRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void recordUsage(UsageRecord usageRecord) {
        records.add(usageRecord);
    }

    public List<UsageRecord> records() {
        return List.copyOf(records);
    }
}
