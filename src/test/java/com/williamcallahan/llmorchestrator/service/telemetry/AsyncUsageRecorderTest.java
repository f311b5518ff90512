package com.williamcallahan.llmorchestrator.service.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.llmorchestrator.domain.UsageRecord;
import com.williamcallahan.llmorchestrator.support.RecordingMetricsSink;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

/**
 * Verifies that usage recording never blocks callers and drops records under back-pressure.
 */
class AsyncUsageRecorderTest {
    private static final Instant TIMESTAMP = Instant.parse("2025-03-15T12:00:00Z");

    @Test
    void close_flushesEveryQueuedRecord() {
        List<UsageRecord> written = new CopyOnWriteArrayList<>();
        RecordingMetricsSink metrics = new RecordingMetricsSink();
        AsyncUsageRecorder recorder = new AsyncUsageRecorder(16, written::addAll, metrics);

        for (int index = 0; index < 5; index++) {
            recorder.recordUsage(usage("openai"));
        }
        recorder.close();

        assertEquals(5, written.size());
        assertEquals(5, recorder.writtenRecords());
        assertEquals(0, recorder.droppedRecords());
    }

    @Test
    void recordUsage_dropsWhenQueueIsFull() throws InterruptedException {
        CountDownLatch writeStarted = new CountDownLatch(1);
        CountDownLatch releaseWriter = new CountDownLatch(1);
        List<UsageRecord> written = new CopyOnWriteArrayList<>();
        UsageWriter slowWriter = batch -> {
            writeStarted.countDown();
            try {
                releaseWriter.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
            written.addAll(batch);
        };
        RecordingMetricsSink metrics = new RecordingMetricsSink();
        AsyncUsageRecorder recorder = new AsyncUsageRecorder(1, slowWriter, metrics);

        recorder.recordUsage(usage("first"));
        assertTrue(writeStarted.await(5, TimeUnit.SECONDS));
        recorder.recordUsage(usage("queued"));
        recorder.recordUsage(usage("dropped"));
        releaseWriter.countDown();
        recorder.close();

        assertEquals(1, recorder.droppedRecords());
        assertEquals(1, metrics.count(MetricNames.USAGE_DROPPED));
        assertEquals(List.of("first", "queued"), written.stream().map(UsageRecord::provider).toList());
    }

    @Test
    void writeFailure_countsBatchAsDropped() {
        UsageWriter failingWriter = batch -> {
            throw new IOException("disk full");
        };
        AsyncUsageRecorder recorder = new AsyncUsageRecorder(8, failingWriter, new RecordingMetricsSink());

        recorder.recordUsage(usage("openai"));
        recorder.close();

        assertEquals(1, recorder.droppedRecords());
        assertEquals(0, recorder.writtenRecords());
    }

    @Test
    void recordUsage_afterCloseIsDropped() {
        AsyncUsageRecorder recorder = new AsyncUsageRecorder(8, batch -> { }, new RecordingMetricsSink());
        recorder.close();

        recorder.recordUsage(usage("late"));

        assertEquals(1, recorder.droppedRecords());
    }

    private static UsageRecord usage(String provider) {
        return new UsageRecord(UUID.randomUUID(), provider, 3, TIMESTAMP, false);
    }
}
