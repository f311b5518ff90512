package com.williamcallahan.llmorchestrator.service.telemetry;

import com.williamcallahan.llmorchestrator.domain.UsageRecord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-blocking {@link UsageSink} that hands records to a background writer.
 *
 * <p>Records go into a bounded queue; when the queue is full the record is dropped and counted
 * rather than blocking the request thread. A single daemon worker drains the queue in batches.</p>
 */
public class AsyncUsageRecorder implements UsageSink, AutoCloseable {
    private static final Logger USAGE_LOG = LoggerFactory.getLogger("USAGE");

    private static final int MAX_BATCH = 256;
    private static final long POLL_MILLIS = 200L;

    private final BlockingQueue<UsageRecord> queue;
    private final UsageWriter writer;
    private final MetricsSink metricsSink;
    private final AtomicLong droppedRecords = new AtomicLong();
    private final AtomicLong writtenRecords = new AtomicLong();
    private final Thread worker;
    private volatile boolean running = true;

    public AsyncUsageRecorder(int queueCapacity, UsageWriter writer, MetricsSink metricsSink) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.writer = Objects.requireNonNull(writer, "writer");
        this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink");
        this.worker = new Thread(this::drainLoop, "usage-recorder");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void recordUsage(UsageRecord usageRecord) {
        if (usageRecord == null) {
            return;
        }
        if (!running || !queue.offer(usageRecord)) {
            long dropped = droppedRecords.incrementAndGet();
            metricsSink.emit(MetricNames.USAGE_DROPPED, 1, Map.of());
            USAGE_LOG.warn("Usage queue full, dropped record (requestId={}, totalDropped={})",
                    usageRecord.requestId(), dropped);
        }
    }

    public long droppedRecords() {
        return droppedRecords.get();
    }

    public long writtenRecords() {
        return writtenRecords.get();
    }

    /**
     * Stops accepting records, writes what is queued and stops the worker.
     */
    @Override
    public void close() {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        flushRemaining();
    }

    private void drainLoop() {
        List<UsageRecord> batch = new ArrayList<>(MAX_BATCH);
        while (running) {
            try {
                UsageRecord first = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, MAX_BATCH - 1);
                writeBatch(batch);
                batch.clear();
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private synchronized void flushRemaining() {
        List<UsageRecord> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        writeBatch(remaining);
    }

    private void writeBatch(List<UsageRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            writer.write(batch);
            writtenRecords.addAndGet(batch.size());
        } catch (IOException | RuntimeException writeFailure) {
            droppedRecords.addAndGet(batch.size());
            USAGE_LOG.error("Failed to persist {} usage record(s)", batch.size(), writeFailure);
        }
    }
}
