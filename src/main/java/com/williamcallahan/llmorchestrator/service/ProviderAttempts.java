package com.williamcallahan.llmorchestrator.service;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.FailureReason;
import com.williamcallahan.llmorchestrator.domain.ProviderFailure;
import com.williamcallahan.llmorchestrator.service.circuit.CallPermission;
import com.williamcallahan.llmorchestrator.service.circuit.ProviderCircuitBreaker;
import com.williamcallahan.llmorchestrator.service.cost.ReservationResult;
import com.williamcallahan.llmorchestrator.service.cost.ReservationToken;
import com.williamcallahan.llmorchestrator.service.history.AttemptRecord;
import com.williamcallahan.llmorchestrator.service.provider.ProviderErrorCategory;
import com.williamcallahan.llmorchestrator.service.provider.ProviderResult;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitDecision;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitScope;
import com.williamcallahan.llmorchestrator.service.routing.RoutingCandidate;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admission and settlement of single provider attempts, shared by blocking and streaming paths.
 *
 * <p>Admission runs the cheap gates in order: deadline, per-request cost ceiling, provider rate
 * limit, circuit breaker, concurrency slot, budget reservation. Every resource taken by a gate is
 * given back when a later gate refuses. An admitted attempt must be settled exactly once by one
 * of the settlement methods. A blocking call started through {@link #submit} returns its slot when
 * the provider call itself returns; otherwise the slot goes back through {@link #releaseSlot}.</p>
 *
 * <p>Every skip and settlement is appended to the attempt history.</p>
 */
final class ProviderAttempts {
    private final OrchestrationContext context;

    ProviderAttempts(OrchestrationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Tries to admit one candidate.
     *
     * @param attemptNumber position of the candidate in the request's ranking, from 1
     */
    Admission admit(CompletionRequest request, RoutingCandidate candidate, int attemptNumber) {
        Admission admission = gate(request, candidate, attemptNumber);
        if (admission instanceof Skipped skipped) {
            remember(request.id(), attemptNumber, skipped.failure().provider(), AttemptRecord.Status.SKIPPED,
                    skipped.failure().reason(), 0L, Duration.ZERO);
        }
        return admission;
    }

    private Admission gate(CompletionRequest request, RoutingCandidate candidate, int attemptNumber) {
        String provider = candidate.provider();
        Instant now = context.clock().instant();
        if (!now.isBefore(request.deadline())) {
            return skipped(provider, FailureReason.DEADLINE_EXCEEDED, "deadline passed before attempt");
        }
        if (candidate.estimatedCents() > request.maxCostCents()) {
            return skipped(provider, FailureReason.COST_CEILING_EXCEEDED,
                    "estimate " + candidate.estimatedCents() + " > ceiling " + request.maxCostCents() + " cents");
        }
        RateLimitDecision providerLimit = context.rateLimiter().allow(RateLimitScope.PROVIDER.key(provider));
        if (!providerLimit.allowed()) {
            return skipped(provider, FailureReason.RATE_LIMITED,
                    "provider bucket empty, retry after " + providerLimit.retryAfter().toMillis() + "ms");
        }
        ProviderCircuitBreaker breaker = context.breakers().forProvider(provider);
        CallPermission permission = breaker.tryAcquirePermission();
        if (!permission.isGranted()) {
            return skipped(provider, FailureReason.PROVIDER_UNAVAILABLE, "circuit open");
        }
        if (!context.concurrencyLimiter().tryAcquire(provider)) {
            releaseTrial(breaker, permission);
            return skipped(provider, FailureReason.AT_CAPACITY, "max concurrency reached");
        }
        ReservationResult reservation = context.costLedger().reserve(provider, candidate.estimatedCents());
        if (reservation instanceof ReservationResult.Rejected rejected) {
            context.concurrencyLimiter().release(provider);
            releaseTrial(breaker, permission);
            return skipped(provider, FailureReason.BUDGET_EXCEEDED, rejected.describe());
        }
        ReservationToken token = ((ReservationResult.Reserved) reservation).token();
        return new Admitted(request.id(), attemptNumber, candidate, token, permission, breaker, now);
    }

    /**
     * Settles a successful attempt.
     *
     * @return cents charged
     */
    long succeeded(Admitted attempt, long actualCents) {
        long charged = context.costLedger().commit(attempt.reservation(), actualCents);
        attempt.breaker().recordSuccess(attempt.permission());
        Duration latency = elapsedSince(attempt.startedAt());
        context.latencyTracker().record(attempt.provider(), latency);
        emitCall(attempt.provider(), "success", latency);
        remember(attempt, AttemptRecord.Status.SUCCEEDED, null, charged, latency);
        return charged;
    }

    /**
     * Settles an attempt that failed before producing any output.
     */
    void failed(Admitted attempt, ProviderErrorCategory category) {
        context.costLedger().release(attempt.reservation());
        if (category.countsAgainstProviderHealth()) {
            attempt.breaker().recordFailure(attempt.permission());
        } else {
            releaseTrial(attempt.breaker(), attempt.permission());
        }
        Duration latency = elapsedSince(attempt.startedAt());
        emitCall(attempt.provider(), category.name().toLowerCase(Locale.ROOT), latency);
        remember(attempt, AttemptRecord.Status.FAILED, category.toFailureReason(), 0L, latency);
    }

    /**
     * Settles a stream that failed after output was delivered: the delivered part is billed.
     *
     * @return cents charged
     */
    long interrupted(Admitted attempt, ProviderErrorCategory category, long deliveredCents) {
        long charged = context.costLedger().commit(attempt.reservation(), deliveredCents);
        if (category.countsAgainstProviderHealth()) {
            attempt.breaker().recordFailure(attempt.permission());
        } else {
            releaseTrial(attempt.breaker(), attempt.permission());
        }
        Duration latency = elapsedSince(attempt.startedAt());
        emitCall(attempt.provider(), "interrupted", latency);
        remember(attempt, AttemptRecord.Status.INTERRUPTED, category.toFailureReason(), charged, latency);
        return charged;
    }

    /**
     * Settles an attempt whose outcome will never be known because the caller cancelled.
     */
    void abandoned(Admitted attempt) {
        context.costLedger().release(attempt.reservation());
        releaseTrial(attempt.breaker(), attempt.permission());
        Duration latency = elapsedSince(attempt.startedAt());
        emitCall(attempt.provider(), "cancelled", latency);
        remember(attempt, AttemptRecord.Status.CANCELLED, null, 0L, latency);
    }

    /**
     * Settles a stream the caller cancelled after output was delivered; the provider is not blamed.
     *
     * @return cents charged
     */
    long cancelledAfterOutput(Admitted attempt, long deliveredCents) {
        long charged = context.costLedger().commit(attempt.reservation(), deliveredCents);
        releaseTrial(attempt.breaker(), attempt.permission());
        Duration latency = elapsedSince(attempt.startedAt());
        emitCall(attempt.provider(), "cancelled", latency);
        remember(attempt, AttemptRecord.Status.CANCELLED, null, charged, latency);
        return charged;
    }

    /**
     * Runs a blocking provider call on the provider executor. The concurrency slot stays held until
     * the call returns, even when the caller stops waiting for it earlier.
     */
    ProviderCall submit(Admitted attempt, Callable<ProviderResult> work) {
        AtomicBoolean slotClaimed = new AtomicBoolean();
        Future<ProviderResult> future = context.providerExecutor().submit(() -> {
            if (!slotClaimed.compareAndSet(false, true)) {
                return null;
            }
            try {
                return work.call();
            } finally {
                releaseSlot(attempt);
            }
        });
        return new ProviderCall(attempt, future, slotClaimed);
    }

    void releaseSlot(Admitted attempt) {
        context.concurrencyLimiter().release(attempt.provider());
    }

    Duration elapsedSince(Instant start) {
        Duration elapsed = Duration.between(start, context.clock().instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private void emitCall(String provider, String outcome, Duration latency) {
        context.metricsSink().emit(MetricNames.PROVIDER_LATENCY, latency.toMillis(),
                Map.of(MetricNames.TAG_PROVIDER, provider, MetricNames.TAG_OUTCOME, outcome));
    }

    private void remember(
            Admitted attempt, AttemptRecord.Status status, FailureReason reason, long costCents, Duration latency) {
        remember(attempt.requestId(), attempt.attemptNumber(), attempt.provider(), status, reason, costCents, latency);
    }

    private void remember(UUID requestId, int attemptNumber, String provider, AttemptRecord.Status status,
            FailureReason reason, long costCents, Duration latency) {
        context.attemptHistory().record(new AttemptRecord(
                requestId, provider, attemptNumber, status, reason, costCents, latency, context.clock().instant()));
    }

    private static void releaseTrial(ProviderCircuitBreaker breaker, CallPermission permission) {
        if (permission == CallPermission.TRIAL) {
            breaker.releaseTrial();
        }
    }

    private static Admission skipped(String provider, FailureReason reason, String detail) {
        return new Skipped(new ProviderFailure(provider, reason, detail));
    }

    /**
     * Handle on a submitted provider call.
     */
    final class ProviderCall {
        private final Admitted attempt;
        private final Future<ProviderResult> future;
        private final AtomicBoolean slotClaimed;

        private ProviderCall(Admitted attempt, Future<ProviderResult> future, AtomicBoolean slotClaimed) {
            this.attempt = attempt;
            this.future = future;
            this.slotClaimed = slotClaimed;
        }

        ProviderResult await(long timeoutMillis) throws InterruptedException, ExecutionException, TimeoutException {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        }

        /**
         * Stops waiting for the call. A call that already started keeps its slot until it returns;
         * one that never started gives the slot back now.
         */
        void abandon() {
            future.cancel(true);
            if (slotClaimed.compareAndSet(false, true)) {
                releaseSlot(attempt);
            }
        }
    }

    /** Result of {@link #admit}. */
    sealed interface Admission permits Admitted, Skipped {}

    /**
     * Attempt cleared every gate; holds a reservation, a concurrency slot and breaker permission.
     */
    record Admitted(
            UUID requestId,
            int attemptNumber,
            RoutingCandidate candidate,
            ReservationToken reservation,
            CallPermission permission,
            ProviderCircuitBreaker breaker,
            Instant startedAt) implements Admission {

        String provider() {
            return candidate.provider();
        }
    }

    /** Attempt refused by a gate; nothing is held. */
    record Skipped(ProviderFailure failure) implements Admission {}
}
