package com.williamcallahan.llmorchestrator.service.telemetry;

import com.williamcallahan.llmorchestrator.domain.UsageRecord;
import java.io.IOException;
import java.util.List;

/**
 * Blocking persistence of usage records, called only from the recorder's worker thread.
 */
@FunctionalInterface
public interface UsageWriter {
    void write(List<UsageRecord> batch) throws IOException;
}
