package com.williamcallahan.llmorchestrator.web;

/**
 * Canonical SSE event types and streaming configuration constants.
 */
public final class SseConstants {

    /** SSE event type for generated text chunks. */
    public static final String EVENT_TEXT = "text";

    /** SSE event type for fallback notices emitted before the first token. */
    public static final String EVENT_STATUS = "status";

    /** SSE event type for the final summary of a completed stream. */
    public static final String EVENT_DONE = "done";

    /** SSE event type for the trailing error marker. */
    public static final String EVENT_ERROR = "error";

    /** SSE comment content for keepalive heartbeats. */
    public static final String COMMENT_KEEPALIVE = "keepalive";

    /** Heartbeat interval in seconds to keep SSE connections alive through proxies. */
    public static final int HEARTBEAT_INTERVAL_SECONDS = 20;

    private SseConstants() {
        // Non-instantiable utility class
    }
}
