package com.williamcallahan.llmorchestrator.service;

import java.util.Objects;

/**
 * Status notice emitted into a stream when a provider fails before its first token and the
 * request moves on to the next candidate.
 *
 * @param summary short caller-facing summary
 * @param code stable machine-readable code, the failure reason name
 * @param retryable whether the condition is transient
 * @param origin provider and attempt context
 */
public record StreamingNotice(String summary, String code, boolean retryable, StreamingNoticeOrigin origin) {
    public StreamingNotice {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary cannot be null or blank");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        Objects.requireNonNull(origin, "origin");
    }

    public String provider() {
        return origin.provider();
    }

    public int attempt() {
        return origin.attempt();
    }

    public int maxAttempts() {
        return origin.maxAttempts();
    }

    /** Creates a builder with the required identification fields. */
    public static Builder builder(String summary, String code) {
        return new Builder(summary, code);
    }

    /**
     * Fluent builder; required fields are given up front, the rest have defaults.
     */
    public static final class Builder {
        private final String summary;
        private final String code;
        private boolean retryable;
        private StreamingNoticeOrigin origin;

        private Builder(String summary, String code) {
            this.summary = summary;
            this.code = code;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder origin(StreamingNoticeOrigin origin) {
            this.origin = origin;
            return this;
        }

        public StreamingNotice build() {
            return new StreamingNotice(summary, code, retryable, origin);
        }
    }
}
