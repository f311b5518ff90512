package com.williamcallahan.llmorchestrator.service.history;

import com.williamcallahan.llmorchestrator.domain.FailureReason;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One provider attempt made on behalf of a request.
 *
 * @param requestId request the attempt served
 * @param provider provider tried
 * @param attemptNumber position of the provider in the request's candidate list, from 1
 * @param status how the attempt ended
 * @param failureReason why it did not succeed, null for successful and cancelled attempts
 * @param costCents cents charged for the attempt
 * @param latency time from admission to settlement, zero for skipped attempts
 * @param recordedAt when the attempt was settled
 */
public record AttemptRecord(
        UUID requestId,
        String provider,
        int attemptNumber,
        Status status,
        FailureReason failureReason,
        long costCents,
        Duration latency,
        Instant recordedAt) {

    public AttemptRecord {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(recordedAt, "recordedAt");
        latency = latency == null ? Duration.ZERO : latency;
    }

    /** How an attempt ended. */
    public enum Status {
        SUCCEEDED,
        /** Refused by an admission gate; the provider was never called. */
        SKIPPED,
        FAILED,
        /** Failed after part of a stream reached the caller. */
        INTERRUPTED,
        CANCELLED
    }
}
