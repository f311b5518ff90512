package com.williamcallahan.llmorchestrator.service.provider;

import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import reactor.core.publisher.Flux;

/**
 * Uniform contract implemented once per external completion provider.
 *
 * <p>Implementations are registered at startup in {@link ProviderClientRegistry}. {@link #send}
 * may block on network I/O and must honor thread interruption so the orchestrator can cancel
 * an attempt when the request deadline passes. {@link #stream} emits text chunks as they arrive
 * and terminates with a {@link ProviderCallException} on failure.</p>
 */
public interface ProviderClient {

    /** Static configuration for this provider. */
    ProviderDescriptor descriptor();

    /** Provider name, shorthand for {@code descriptor().name()}. */
    default String name() {
        return descriptor().name();
    }

    /**
     * Executes a completion and reports failures as a categorized result.
     *
     * @param request provider-neutral call
     * @return success with the response, or a categorized failure
     */
    ProviderResult send(ModelRequest request);

    /**
     * Streams a completion as text chunks.
     *
     * @param request provider-neutral call
     * @return cold flux of text chunks
     */
    Flux<String> stream(ModelRequest request);

    /**
     * Pessimistic cost estimate used to reserve budget before the call.
     *
     * @param request call about to be made
     * @return estimated cost in whole cents
     */
    long estimateCostCents(ModelRequest request);

    /**
     * Cost actually incurred by a completed call.
     *
     * @param request call that was made
     * @param response provider response
     * @return actual cost in whole cents
     */
    long actualCostCents(ModelRequest request, ModelResponse response);

    /**
     * Cost incurred by a stream that produced {@code deliveredText} before it ended.
     *
     * @param request call that was made
     * @param deliveredText text emitted so far
     * @return cost in whole cents
     */
    long streamedCostCents(ModelRequest request, String deliveredText);
}
