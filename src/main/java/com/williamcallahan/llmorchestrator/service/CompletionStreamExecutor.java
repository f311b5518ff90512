package com.williamcallahan.llmorchestrator.service;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.CompletionResponse;
import com.williamcallahan.llmorchestrator.domain.FailureReason;
import com.williamcallahan.llmorchestrator.domain.OrchestrationError;
import com.williamcallahan.llmorchestrator.domain.OrchestrationResult;
import com.williamcallahan.llmorchestrator.domain.ProviderFailure;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCacheKeys;
import com.williamcallahan.llmorchestrator.service.provider.ProviderCallException;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClient;
import com.williamcallahan.llmorchestrator.service.provider.ProviderErrorCategory;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitDecision;
import com.williamcallahan.llmorchestrator.service.routing.RoutingCandidate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Streaming counterpart of the candidate loop in {@link CompletionOrchestrator}.
 *
 * <p>Fallback is allowed only while nothing has reached the caller. Once the first token is
 * forwarded the attempt is committed to its provider: a later failure bills the delivered
 * tokens and ends the stream with a partial {@link StreamEvent.Failed} marker.</p>
 */
final class CompletionStreamExecutor {
    private static final Logger log = LoggerFactory.getLogger(CompletionStreamExecutor.class);

    private final OrchestrationContext context;
    private final ProviderAttempts attempts;
    private final CompletionOrchestrator orchestrator;

    CompletionStreamExecutor(OrchestrationContext context, ProviderAttempts attempts, CompletionOrchestrator orchestrator) {
        this.context = context;
        this.attempts = attempts;
        this.orchestrator = orchestrator;
    }

    Flux<StreamEvent> events(CompletionRequest request) {
        return Flux.defer(() -> start(request)).doOnNext(event -> {
            if (event instanceof StreamEvent.Completed completed) {
                orchestrator.emitOutcome(OrchestrationResult.completed(completed.response()));
            } else if (event instanceof StreamEvent.Failed failed) {
                orchestrator.emitOutcome(OrchestrationResult.rejected(failed.error()));
            }
        });
    }

    private Flux<StreamEvent> start(CompletionRequest request) {
        Instant startedAt = context.clock().instant();
        RateLimitDecision decision = orchestrator.checkCallerLimits(request);
        if (!decision.allowed()) {
            return failed(OrchestrationError.rateLimited(decision.scopeKey(), decision.retryAfter()));
        }
        String cacheKey = ResponseCacheKeys.forRequest(request);
        Optional<CompletionResponse> cached = orchestrator.cachedResponse(request, cacheKey, startedAt);
        if (cached.isPresent()) {
            CompletionResponse response = cached.get();
            return Flux.just(new StreamEvent.Token(response.text()), new StreamEvent.Completed(response));
        }
        List<RoutingCandidate> candidates = context.router().candidateProviders(request);
        if (candidates.isEmpty()) {
            log.warn("No eligible provider for stream (requestId={})", request.id());
            return failed(OrchestrationError.allProvidersExhausted(List.of()));
        }
        return attempt(new StreamRun(request, cacheKey, startedAt, candidates), 0);
    }

    private Flux<StreamEvent> attempt(StreamRun run, int index) {
        return Flux.defer(() -> {
            if (index >= run.candidates().size()) {
                return exhausted(run);
            }
            ProviderAttempts.Admission admission = attempts.admit(run.request(), run.candidates().get(index), index + 1);
            if (admission instanceof ProviderAttempts.Skipped skipped) {
                run.failures().add(skipped.failure());
                if (skipped.failure().reason() == FailureReason.DEADLINE_EXCEEDED) {
                    return exhausted(run);
                }
                return attempt(run, index + 1);
            }
            run.admittedAny().set(true);
            return admitted(run, index, (ProviderAttempts.Admitted) admission);
        });
    }

    private Flux<StreamEvent> admitted(StreamRun run, int index, ProviderAttempts.Admitted admitted) {
        ProviderClient client = admitted.candidate().client();
        StringBuilder delivered = new StringBuilder();
        AtomicBoolean settled = new AtomicBoolean();
        log.info("Streaming from provider (requestId={}, provider={}, attempt={}/{})",
                run.request().id(), client.name(), index + 1, run.candidates().size());

        Flux<String> chunks = client.stream(admitted.candidate().modelRequest())
                .timeout(Mono.defer(() -> Mono.delay(waitLimit(run.request(), client))),
                        chunk -> Mono.defer(() -> Mono.delay(waitLimit(run.request(), client))))
                .doFinally(signal -> attempts.releaseSlot(admitted));

        return chunks
                .filter(chunk -> !chunk.isEmpty())
                .doOnNext(delivered::append)
                .<StreamEvent>map(StreamEvent.Token::new)
                .concatWith(Mono.fromCallable(() -> complete(run, admitted, delivered, settled)))
                .doOnCancel(() -> cancelled(run, admitted, delivered, settled))
                .onErrorResume(error -> recover(run, index, admitted, delivered, settled, error));
    }

    private StreamEvent complete(
            StreamRun run, ProviderAttempts.Admitted admitted, StringBuilder delivered, AtomicBoolean settled) {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException("Stream attempt already settled for " + admitted.provider());
        }
        ProviderClient client = admitted.candidate().client();
        String text = delivered.toString();
        long charged = attempts.succeeded(
                admitted, client.streamedCostCents(admitted.candidate().modelRequest(), text));
        CompletionResponse response = new CompletionResponse(
                run.request().id(),
                text,
                client.name(),
                admitted.candidate().modelRequest().model(),
                charged,
                false,
                attempts.elapsedSince(run.startedAt()));
        orchestrator.storeInCache(run.cacheKey(), response);
        orchestrator.recordUsage(run.request(), client.name(), charged, false);
        return new StreamEvent.Completed(response);
    }

    private void cancelled(
            StreamRun run, ProviderAttempts.Admitted admitted, StringBuilder delivered, AtomicBoolean settled) {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        log.info("Stream cancelled by caller (requestId={}, provider={}, deliveredChars={})",
                run.request().id(), admitted.provider(), delivered.length());
        if (delivered.length() == 0) {
            attempts.abandoned(admitted);
            return;
        }
        ProviderClient client = admitted.candidate().client();
        long charged = attempts.cancelledAfterOutput(
                admitted, client.streamedCostCents(admitted.candidate().modelRequest(), delivered.toString()));
        orchestrator.recordUsage(run.request(), client.name(), charged, false);
    }

    private Flux<StreamEvent> recover(
            StreamRun run,
            int index,
            ProviderAttempts.Admitted admitted,
            StringBuilder delivered,
            AtomicBoolean settled,
            Throwable error) {
        if (!settled.compareAndSet(false, true)) {
            return Flux.error(error);
        }
        ProviderClient client = admitted.candidate().client();
        ProviderErrorCategory category = categorize(error);
        ProviderFailure failure = new ProviderFailure(client.name(), category.toFailureReason(), describe(error));

        if (delivered.length() > 0) {
            long charged = attempts.interrupted(
                    admitted, category, client.streamedCostCents(admitted.candidate().modelRequest(), delivered.toString()));
            orchestrator.recordUsage(run.request(), client.name(), charged, false);
            log.warn("Stream interrupted after output (requestId={}, provider={}, reason={}, chargedCents={})",
                    run.request().id(), client.name(), failure.reason(), charged);
            return Flux.just(new StreamEvent.Failed(OrchestrationError.streamInterrupted(failure), true));
        }

        attempts.failed(admitted, category);
        run.failures().add(failure);
        if (!category.isFallbackEligible()) {
            log.warn("Stream rejected by provider, not retrying (requestId={}, provider={}, reason={})",
                    run.request().id(), client.name(), failure.reason());
            return failed(OrchestrationError.fatal(failure));
        }
        if (index + 1 >= run.candidates().size()) {
            return failed(CompletionOrchestrator.exhausted(run.failures()));
        }
        log.warn("Stream failed before first token, falling back (requestId={}, provider={}, reason={})",
                run.request().id(), client.name(), failure.reason());
        StreamingNotice notice = StreamingNotice.builder(
                        "Provider " + client.name() + " failed before responding; trying the next provider",
                        failure.reason().name())
                .retryable(true)
                .origin(new StreamingNoticeOrigin(client.name(), index + 1, run.candidates().size()))
                .build();
        return Flux.<StreamEvent>just(new StreamEvent.Notice(notice)).concatWith(attempt(run, index + 1));
    }

    /**
     * Longest wait for the next chunk: the provider timeout, cut short by the request deadline.
     */
    private Duration waitLimit(CompletionRequest request, ProviderClient client) {
        Duration untilDeadline = Duration.between(context.clock().instant(), request.deadline());
        if (untilDeadline.isNegative()) {
            return Duration.ZERO;
        }
        return untilDeadline.compareTo(client.descriptor().timeout()) < 0 ? untilDeadline : client.descriptor().timeout();
    }

    private static ProviderErrorCategory categorize(Throwable error) {
        if (error instanceof ProviderCallException callException) {
            return callException.getCategory();
        }
        if (error instanceof TimeoutException) {
            return ProviderErrorCategory.TIMEOUT;
        }
        return ProviderErrorCategory.SERVER_ERROR;
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "no chunk before timeout";
        }
        return error.getClass().getSimpleName();
    }

    private Flux<StreamEvent> exhausted(StreamRun run) {
        orchestrator.refundGlobalIfProviderLimited(run.request(), run.admittedAny().get(), run.failures());
        return failed(CompletionOrchestrator.exhausted(run.failures()));
    }

    private static Flux<StreamEvent> failed(OrchestrationError error) {
        return Flux.just(new StreamEvent.Failed(error, false));
    }

    /** Per-subscription state shared by the attempts of one stream. */
    private record StreamRun(
            CompletionRequest request, String cacheKey, Instant startedAt, List<RoutingCandidate> candidates,
            List<ProviderFailure> failures, AtomicBoolean admittedAny) {

        StreamRun(CompletionRequest request, String cacheKey, Instant startedAt, List<RoutingCandidate> candidates) {
            this(request, cacheKey, startedAt, candidates, new ArrayList<>(), new AtomicBoolean());
        }
    }
}
