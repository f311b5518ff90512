package com.williamcallahan.llmorchestrator.service;

import com.williamcallahan.llmorchestrator.domain.CompletionResponse;
import com.williamcallahan.llmorchestrator.domain.OrchestrationError;
import java.util.Objects;

/**
 * Items of a completion stream. A stream carries any number of tokens and notices and ends
 * with exactly one {@link Completed} or {@link Failed}.
 */
public sealed interface StreamEvent
        permits StreamEvent.Token, StreamEvent.Notice, StreamEvent.Completed, StreamEvent.Failed {

    /** Returns whether this event ends the stream. */
    default boolean isTerminal() {
        return this instanceof Completed || this instanceof Failed;
    }

    /**
     * A chunk of generated text.
     *
     * @param text chunk content
     */
    record Token(String text) implements StreamEvent {
        public Token {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * A provider failed before producing output and the next candidate is being tried.
     *
     * @param notice fallback details
     */
    record Notice(StreamingNotice notice) implements StreamEvent {
        public Notice {
            Objects.requireNonNull(notice, "notice");
        }
    }

    /**
     * The stream finished; the response holds the full text and settled cost.
     *
     * @param response completed response
     */
    record Completed(CompletionResponse response) implements StreamEvent {
        public Completed {
            Objects.requireNonNull(response, "response");
        }
    }

    /**
     * Trailing error marker.
     *
     * @param error structured error
     * @param partial whether tokens were delivered before the failure
     */
    record Failed(OrchestrationError error, boolean partial) implements StreamEvent {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
