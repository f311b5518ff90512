package com.williamcallahan.llmorchestrator.service;

import java.util.Objects;
import reactor.core.publisher.Flux;

/**
 * Result of a streaming request, consumable reactively or through a blocking iterator.
 *
 * <p>The underlying flux is cold: nothing is called until it is subscribed, and each
 * subscription runs the request once. Cancelling the subscription cancels the request.</p>
 */
public final class CompletionStream {
    private final Flux<StreamEvent> events;
    private final int bufferSize;

    CompletionStream(Flux<StreamEvent> events, int bufferSize) {
        this.events = Objects.requireNonNull(events, "events");
        this.bufferSize = bufferSize;
    }

    /** Events as a reactive stream. */
    public Flux<StreamEvent> events() {
        return events;
    }

    /**
     * Events through a bounded queue; iteration blocks until the next event is available.
     */
    public Iterable<StreamEvent> blockingEvents() {
        return events.toIterable(bufferSize);
    }
}
