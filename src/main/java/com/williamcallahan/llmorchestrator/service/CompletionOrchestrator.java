package com.williamcallahan.llmorchestrator.service;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.CompletionResponse;
import com.williamcallahan.llmorchestrator.domain.FailureReason;
import com.williamcallahan.llmorchestrator.domain.OrchestrationError;
import com.williamcallahan.llmorchestrator.domain.OrchestrationResult;
import com.williamcallahan.llmorchestrator.domain.ProviderFailure;
import com.williamcallahan.llmorchestrator.domain.SynthesisStrategy;
import com.williamcallahan.llmorchestrator.domain.UsageRecord;
import com.williamcallahan.llmorchestrator.service.cache.CachedCompletion;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCacheKeys;
import com.williamcallahan.llmorchestrator.service.history.AttemptRecord;
import com.williamcallahan.llmorchestrator.service.provider.ModelResponse;
import com.williamcallahan.llmorchestrator.service.provider.ProviderCallException;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClient;
import com.williamcallahan.llmorchestrator.service.provider.ProviderErrorCategory;
import com.williamcallahan.llmorchestrator.service.provider.ProviderResult;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitDecision;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitScope;
import com.williamcallahan.llmorchestrator.service.routing.RoutingCandidate;
import com.williamcallahan.llmorchestrator.service.telemetry.MetricNames;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Executes logical completion requests across the registered providers.
 *
 * <p>Each request passes the caller rate limits (IP, user, global), then the response cache.
 * On a miss, identical concurrent requests are coalesced and the leader walks the router's
 * ranked candidates: admission gates, provider call bounded by the request deadline, then
 * either commit + cache + return, or release + breaker failure + next candidate. Provider
 * failures are values, never exceptions, so the loop is plain iteration.</p>
 *
 * <p>Authentication and invalid-request failures abort at once. If every candidate failed for
 * budget reasons the caller gets {@code BUDGET_EXCEEDED}, otherwise {@code ALL_PROVIDERS_EXHAUSTED}
 * with one diagnostic per candidate. Interrupting the calling thread cancels the request without
 * fallback. A request that no provider admitted because provider rate limits refused it gets its
 * global rate-limit token back.</p>
 */
public class CompletionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CompletionOrchestrator.class);

    private final OrchestrationContext context;
    private final OrchestrationSettings settings;
    private final ProviderAttempts attempts;
    private final RequestCoalescer coalescer;
    private final CompletionStreamExecutor streamExecutor;

    public CompletionOrchestrator(OrchestrationContext context, OrchestrationSettings settings) {
        this.context = Objects.requireNonNull(context, "context");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.attempts = new ProviderAttempts(context);
        this.coalescer = new RequestCoalescer(settings.coalescingWindow(), context.clock());
        this.streamExecutor = new CompletionStreamExecutor(context, attempts, this);
    }

    /**
     * Executes one request on the calling thread.
     *
     * @param request request to serve
     * @return response or structured terminal error
     */
    public OrchestrationResult execute(CompletionRequest request) {
        Objects.requireNonNull(request, "request");
        Instant startedAt = context.clock().instant();
        OrchestrationResult result = serve(request, startedAt);
        emitOutcome(result);
        return result;
    }

    /**
     * Executes a request as a token stream.
     *
     * <p>Output is forwarded as it arrives. A provider failing before its first token is replaced by
     * the next candidate and a notice is emitted; a failure after output ends the stream with a
     * {@link StreamEvent.Failed} marker and the delivered part is billed.</p>
     */
    public CompletionStream executeStreaming(CompletionRequest request) {
        Objects.requireNonNull(request, "request");
        return new CompletionStream(streamExecutor.events(request), settings.streamBufferSize());
    }

    /**
     * Executes independent requests concurrently; requests sharing a cache key share one call.
     *
     * @return results in request order
     */
    public List<OrchestrationResult> executeBatch(List<CompletionRequest> requests) {
        List<CompletableFuture<OrchestrationResult>> pending = requests.stream()
                .map(request -> CompletableFuture.supplyAsync(() -> execute(request), context.requestExecutor()))
                .toList();
        List<OrchestrationResult> results = new ArrayList<>(pending.size());
        for (int index = 0; index < pending.size(); index++) {
            try {
                results.add(pending.get(index).get());
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                pending.forEach(future -> future.cancel(true));
                for (int remaining = index; remaining < pending.size(); remaining++) {
                    results.add(OrchestrationResult.rejected(OrchestrationError.cancelled()));
                }
                return List.copyOf(results);
            } catch (ExecutionException executionFailure) {
                throw new IllegalStateException("Batch member failed unexpectedly", executionFailure.getCause());
            }
        }
        return List.copyOf(results);
    }

    /**
     * Executes a request on a bounded elastic worker.
     */
    public Mono<OrchestrationResult> executeAsync(CompletionRequest request) {
        return Mono.fromCallable(() -> execute(request)).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Sends one request to several providers in parallel and returns a single chosen answer.
     *
     * <p>Candidates are the router's top {@code maxProviders}, each passing the usual admission
     * gates. The response carries the winner's text and provider and the summed cost of every
     * provider that answered. Synthesized answers bypass the response cache. With fewer than two
     * eligible providers the request is served like {@link #execute}.</p>
     *
     * @param request request to serve
     * @param strategy how the answer is chosen
     * @param maxProviders most providers to query, at least two
     * @return chosen response or structured terminal error
     */
    public OrchestrationResult synthesize(CompletionRequest request, SynthesisStrategy strategy, int maxProviders) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(strategy, "strategy");
        if (maxProviders < 2) {
            throw new IllegalArgumentException("maxProviders must be at least 2");
        }
        Instant startedAt = context.clock().instant();
        RateLimitDecision decision = checkCallerLimits(request);
        OrchestrationResult result;
        if (!decision.allowed()) {
            result = OrchestrationResult.rejected(OrchestrationError.rateLimited(decision.scopeKey(), decision.retryAfter()));
        } else {
            List<RoutingCandidate> candidates = context.router().candidateProviders(request);
            if (candidates.size() < 2) {
                log.info("Fewer than two eligible providers, serving without synthesis (requestId={})", request.id());
                result = serveWithinLimits(request, startedAt);
            } else {
                result = synthesizeAcross(
                        request, strategy, candidates.subList(0, Math.min(maxProviders, candidates.size())), startedAt);
            }
        }
        emitOutcome(result);
        return result;
    }

    /**
     * Runs {@link #synthesize} on a bounded elastic worker.
     */
    public Mono<OrchestrationResult> synthesizeAsync(
            CompletionRequest request, SynthesisStrategy strategy, int maxProviders) {
        return Mono.fromCallable(() -> synthesize(request, strategy, maxProviders)).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Provider attempts settled within {@code window} of now, oldest first.
     */
    public List<AttemptRecord> recentAttempts(Duration window) {
        return context.attemptHistory().recent(window);
    }

    /** Callers that received another request's shared result. */
    public long coalescedWaiters() {
        return coalescer.coalescedWaiters();
    }

    /**
     * Applies the caller-scope rate limits in the order IP, user, global.
     */
    RateLimitDecision checkCallerLimits(CompletionRequest request) {
        List<String> scopeKeys = new ArrayList<>(3);
        if (request.clientIp() != null && !request.clientIp().isBlank()) {
            scopeKeys.add(RateLimitScope.IP.key(request.clientIp()));
        }
        if (request.userId() != null && !request.userId().isBlank()) {
            scopeKeys.add(RateLimitScope.USER.key(request.userId()));
        }
        scopeKeys.add(RateLimitScope.GLOBAL.key(null));
        return context.rateLimiter().allowAll(scopeKeys);
    }

    /**
     * Looks up a cached completion and turns it into a zero-cost response.
     */
    Optional<CompletionResponse> cachedResponse(CompletionRequest request, String cacheKey, Instant startedAt) {
        return context.responseCache().get(cacheKey)
                .flatMap(context.cacheCodec()::decode)
                .map(cached -> {
                    log.debug("Cache hit (requestId={}, provider={})", request.id(), cached.provider());
                    CompletionResponse response = new CompletionResponse(
                            request.id(), cached.text(), cached.provider(), cached.model(), 0L, true,
                            attempts.elapsedSince(startedAt));
                    recordUsage(request, cached.provider(), 0L, true);
                    return response;
                });
    }

    void storeInCache(String cacheKey, CompletionResponse response) {
        if (response.text().isEmpty()) {
            return;
        }
        CachedCompletion cached = new CachedCompletion(
                response.text(), response.provider(), response.model(), context.clock().instant());
        context.responseCache().put(cacheKey, context.cacheCodec().encode(cached));
    }

    void recordUsage(CompletionRequest request, String provider, long costCents, boolean cacheHit) {
        context.usageSink().recordUsage(
                new UsageRecord(request.id(), provider, costCents, context.clock().instant(), cacheHit));
    }

    /**
     * Terminal error after every candidate was tried or skipped.
     */
    static OrchestrationError exhausted(List<ProviderFailure> failures) {
        if (!failures.isEmpty() && failures.stream().allMatch(failure -> failure.reason().isBudgetRelated())) {
            return OrchestrationError.budgetExceeded(failures);
        }
        if (!failures.isEmpty() && failures.get(failures.size() - 1).reason() == FailureReason.DEADLINE_EXCEEDED) {
            return OrchestrationError.timeout(failures);
        }
        return OrchestrationError.allProvidersExhausted(failures);
    }

    /**
     * Returns the global token taken by {@link #checkCallerLimits} when the request never reached a
     * provider because provider rate limits turned it away.
     */
    void refundGlobalIfProviderLimited(CompletionRequest request, boolean admittedAny, List<ProviderFailure> failures) {
        if (admittedAny || failures.stream().noneMatch(failure -> failure.reason() == FailureReason.RATE_LIMITED)) {
            return;
        }
        context.rateLimiter().refund(RateLimitScope.GLOBAL.key(null));
        log.debug("Refunded global rate-limit token (requestId={})", request.id());
    }

    void emitOutcome(OrchestrationResult result) {
        String outcome = result.response()
                .map(response -> response.cacheHit() ? "cache_hit" : "success")
                .orElseGet(() -> result.error().map(error -> error.code().name().toLowerCase(Locale.ROOT)).orElse("unknown"));
        context.metricsSink().emit(MetricNames.REQUEST_OUTCOME, 1, Map.of(MetricNames.TAG_OUTCOME, outcome));
    }

    private OrchestrationResult serve(CompletionRequest request, Instant startedAt) {
        RateLimitDecision decision = checkCallerLimits(request);
        if (!decision.allowed()) {
            return OrchestrationResult.rejected(OrchestrationError.rateLimited(decision.scopeKey(), decision.retryAfter()));
        }
        return serveWithinLimits(request, startedAt);
    }

    private OrchestrationResult serveWithinLimits(CompletionRequest request, Instant startedAt) {
        String cacheKey = ResponseCacheKeys.forRequest(request);
        Optional<CompletionResponse> cached = cachedResponse(request, cacheKey, startedAt);
        if (cached.isPresent()) {
            return OrchestrationResult.completed(cached.get());
        }
        if (!settings.coalescingEnabled()) {
            return executeUncached(request, cacheKey, startedAt);
        }
        OrchestrationResult shared = coalescer.execute(
                cacheKey, request.deadline(), () -> executeUncached(request, cacheKey, startedAt));
        return attributeTo(request, shared, startedAt);
    }

    private OrchestrationResult attributeTo(CompletionRequest request, OrchestrationResult shared, Instant startedAt) {
        Optional<CompletionResponse> response = shared.response();
        if (response.isEmpty() || response.get().requestId().equals(request.id())) {
            return shared;
        }
        CompletionResponse own = response.get().sharedWith(request.id(), attempts.elapsedSince(startedAt));
        recordUsage(request, own.provider(), 0L, true);
        context.metricsSink().emit(MetricNames.COALESCED, 1, Map.of(MetricNames.TAG_PROVIDER, own.provider()));
        return OrchestrationResult.completed(own);
    }

    private OrchestrationResult executeUncached(CompletionRequest request, String cacheKey, Instant startedAt) {
        List<RoutingCandidate> candidates = context.router().candidateProviders(request);
        if (candidates.isEmpty()) {
            log.warn("No eligible provider (requestId={})", request.id());
            return OrchestrationResult.rejected(OrchestrationError.allProvidersExhausted(List.of()));
        }
        List<ProviderFailure> failures = new ArrayList<>(candidates.size());
        boolean admittedAny = false;
        for (int index = 0; index < candidates.size(); index++) {
            ProviderAttempts.Admission admission = attempts.admit(request, candidates.get(index), index + 1);
            if (admission instanceof ProviderAttempts.Skipped skipped) {
                failures.add(skipped.failure());
                if (skipped.failure().reason() == FailureReason.DEADLINE_EXCEEDED) {
                    break;
                }
                continue;
            }
            admittedAny = true;
            ProviderAttempts.Admitted admitted = (ProviderAttempts.Admitted) admission;
            AttemptOutcome outcome = call(request, admitted);
            if (outcome.cancelled()) {
                return OrchestrationResult.rejected(OrchestrationError.cancelled());
            }
            if (outcome.response() != null) {
                storeInCache(cacheKey, outcome.response());
                CompletionResponse response = new CompletionResponse(
                        request.id(),
                        outcome.response().text(),
                        outcome.response().provider(),
                        outcome.response().model(),
                        outcome.response().costCents(),
                        false,
                        attempts.elapsedSince(startedAt));
                return OrchestrationResult.completed(response);
            }
            ProviderFailure failure = outcome.failure();
            failures.add(failure);
            if (isFatal(failure.reason())) {
                log.warn("Request rejected by provider, not retrying (requestId={}, provider={}, reason={})",
                        request.id(), failure.provider(), failure.reason());
                return OrchestrationResult.rejected(OrchestrationError.fatal(failure));
            }
            log.warn("Provider attempt failed, falling back (requestId={}, provider={}, reason={})",
                    request.id(), failure.provider(), failure.reason());
        }
        refundGlobalIfProviderLimited(request, admittedAny, failures);
        return OrchestrationResult.rejected(exhausted(failures));
    }

    private OrchestrationResult synthesizeAcross(
            CompletionRequest request, SynthesisStrategy strategy, List<RoutingCandidate> candidates, Instant startedAt) {
        List<ProviderFailure> failures = new ArrayList<>();
        List<InFlight> inFlight = new ArrayList<>(candidates.size());
        for (int index = 0; index < candidates.size(); index++) {
            ProviderAttempts.Admission admission = attempts.admit(request, candidates.get(index), index + 1);
            if (admission instanceof ProviderAttempts.Skipped skipped) {
                failures.add(skipped.failure());
                continue;
            }
            ProviderAttempts.Admitted admitted = (ProviderAttempts.Admitted) admission;
            try {
                inFlight.add(launch(request, admitted));
            } catch (RejectedExecutionException rejected) {
                failures.add(saturated(admitted).failure());
            }
        }
        log.info("Synthesizing across providers (requestId={}, strategy={}, launched={})",
                request.id(), strategy, inFlight.size());

        List<ResponseSynthesizer.Ballot> ballots = new ArrayList<>(inFlight.size());
        long totalCents = 0L;
        for (int index = 0; index < inFlight.size(); index++) {
            InFlight pending = inFlight.get(index);
            AttemptOutcome outcome = await(request, pending, pending.remainingMillis());
            if (outcome.cancelled()) {
                inFlight.subList(index + 1, inFlight.size()).forEach(this::cancel);
                return OrchestrationResult.rejected(OrchestrationError.cancelled());
            }
            if (outcome.response() == null) {
                failures.add(outcome.failure());
                log.warn("Synthesis member failed (requestId={}, provider={}, reason={})",
                        request.id(), outcome.failure().provider(), outcome.failure().reason());
                continue;
            }
            totalCents += outcome.response().costCents();
            ballots.add(new ResponseSynthesizer.Ballot(
                    outcome.response(), pending.admitted().candidate().client().descriptor().weight()));
        }
        if (ballots.isEmpty()) {
            refundGlobalIfProviderLimited(request, !inFlight.isEmpty(), failures);
            return OrchestrationResult.rejected(exhausted(failures));
        }
        CompletionResponse chosen = ResponseSynthesizer.choose(strategy, ballots).response();
        log.info("Synthesized answer (requestId={}, strategy={}, provider={}, answers={}, costCents={})",
                request.id(), strategy, chosen.provider(), ballots.size(), totalCents);
        return OrchestrationResult.completed(new CompletionResponse(
                request.id(), chosen.text(), chosen.provider(), chosen.model(), totalCents, false,
                attempts.elapsedSince(startedAt)));
    }

    private AttemptOutcome call(CompletionRequest request, ProviderAttempts.Admitted admitted) {
        InFlight pending;
        try {
            pending = launch(request, admitted);
        } catch (RejectedExecutionException rejected) {
            return saturated(admitted);
        }
        return await(request, pending, pending.timeout().toMillis());
    }

    /**
     * Starts the provider call for an admitted attempt.
     *
     * @throws RejectedExecutionException when the provider executor refuses the call
     */
    private InFlight launch(CompletionRequest request, ProviderAttempts.Admitted admitted) {
        ProviderClient client = admitted.candidate().client();
        Duration untilDeadline = Duration.between(context.clock().instant(), request.deadline());
        Duration attemptTimeout = untilDeadline.compareTo(client.descriptor().timeout()) < 0
                ? untilDeadline
                : client.descriptor().timeout();
        log.info("Calling provider (requestId={}, provider={}, estimateCents={})",
                request.id(), client.name(), admitted.candidate().estimatedCents());
        ProviderAttempts.ProviderCall call =
                attempts.submit(admitted, () -> client.send(admitted.candidate().modelRequest()));
        return new InFlight(admitted, call, attemptTimeout, System.nanoTime());
    }

    private AttemptOutcome saturated(ProviderAttempts.Admitted admitted) {
        attempts.releaseSlot(admitted);
        attempts.abandoned(admitted);
        return AttemptOutcome.failed(
                new ProviderFailure(admitted.provider(), FailureReason.AT_CAPACITY, "provider executor saturated"));
    }

    private void cancel(InFlight pending) {
        pending.call().abandon();
        attempts.abandoned(pending.admitted());
    }

    private AttemptOutcome await(CompletionRequest request, InFlight pending, long waitMillis) {
        ProviderAttempts.Admitted admitted = pending.admitted();
        ProviderClient client = admitted.candidate().client();
        ProviderAttempts.ProviderCall call = pending.call();
        ProviderResult result;
        try {
            result = call.await(Math.max(1L, waitMillis));
        } catch (TimeoutException timedOut) {
            call.abandon();
            attempts.failed(admitted, ProviderErrorCategory.TIMEOUT);
            return AttemptOutcome.failed(new ProviderFailure(
                    client.name(), FailureReason.TIMEOUT, "no response within " + pending.timeout().toMillis() + "ms"));
        } catch (InterruptedException interrupted) {
            cancel(pending);
            Thread.currentThread().interrupt();
            log.info("Request cancelled by caller (requestId={}, provider={})", request.id(), client.name());
            return AttemptOutcome.CANCELLED;
        } catch (ExecutionException executionFailure) {
            Throwable cause = executionFailure.getCause();
            ProviderErrorCategory category = cause instanceof ProviderCallException callException
                    ? callException.getCategory()
                    : ProviderErrorCategory.SERVER_ERROR;
            attempts.failed(admitted, category);
            return AttemptOutcome.failed(new ProviderFailure(
                    client.name(), category.toFailureReason(), cause.getClass().getSimpleName()));
        }

        if (result instanceof ProviderResult.Failure failure) {
            attempts.failed(admitted, failure.category());
            return AttemptOutcome.failed(
                    new ProviderFailure(client.name(), failure.category().toFailureReason(), failure.message()));
        }
        ModelResponse modelResponse = ((ProviderResult.Success) result).response();
        long actualCents = client.actualCostCents(admitted.candidate().modelRequest(), modelResponse);
        long charged = attempts.succeeded(admitted, actualCents);
        recordUsage(request, client.name(), charged, false);
        return AttemptOutcome.succeeded(new CompletionResponse(
                request.id(), modelResponse.text(), client.name(), modelResponse.model(), charged, false, Duration.ZERO));
    }

    private static boolean isFatal(FailureReason reason) {
        return reason == FailureReason.AUTH_ERROR || reason == FailureReason.INVALID_REQUEST;
    }

    /** Provider call running on the provider executor. */
    private record InFlight(
            ProviderAttempts.Admitted admitted, ProviderAttempts.ProviderCall call, Duration timeout, long launchedAtNanos) {

        long remainingMillis() {
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - launchedAtNanos);
            return timeout.toMillis() - elapsedMillis;
        }
    }

    /** Outcome of one provider call. */
    private record AttemptOutcome(CompletionResponse response, ProviderFailure failure, boolean cancelled) {
        static final AttemptOutcome CANCELLED = new AttemptOutcome(null, null, true);

        static AttemptOutcome succeeded(CompletionResponse response) {
            return new AttemptOutcome(response, null, false);
        }

        static AttemptOutcome failed(ProviderFailure failure) {
            return new AttemptOutcome(null, failure, false);
        }
    }
}
