package com.williamcallahan.llmorchestrator.web;

import static com.williamcallahan.llmorchestrator.web.SseConstants.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.williamcallahan.llmorchestrator.domain.CompletionResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiCompletionResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiErrorResponse;
import com.williamcallahan.llmorchestrator.service.StreamEvent;
import com.williamcallahan.llmorchestrator.service.StreamingNotice;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Turns orchestrator stream events into Server-Sent Events.
 *
 * <p>Text chunks are JSON-wrapped so leading and trailing whitespace survives SSE framing.</p>
 */
@Component
public class SseSupport {
    private static final Logger log = LoggerFactory.getLogger(SseSupport.class);

    /** Fallback JSON payload when SSE error serialization fails. */
    private static final String ERROR_FALLBACK_JSON =
            "{\"status\":\"error\",\"message\":\"Error serialization failed\"}";

    private static final Counter STREAM_ERROR_COUNTER = Metrics.counter("orchestrator.sse.error_events");

    private final ObjectWriter jsonWriter;

    /**
     * Creates SSE support wired to the application's ObjectMapper.
     *
     * @param objectMapper JSON mapper for safe SSE serialization
     */
    public SseSupport(ObjectMapper objectMapper) {
        this.jsonWriter = objectMapper.writer();
    }

    /**
     * Configures HTTP response headers for SSE streaming through proxies.
     *
     * @param response the servlet response to configure
     */
    public void configureStreamingHeaders(HttpServletResponse response) {
        response.addHeader("X-Accel-Buffering", "no"); // Nginx: disable proxy buffering
        response.addHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform");
    }

    /**
     * Converts a stream of orchestrator events into SSE events with keepalive comments.
     *
     * @param events orchestrator events, subscribed once
     * @return SSE events ending after the terminal event
     */
    public Flux<ServerSentEvent<String>> toServerSentEvents(Flux<StreamEvent> events) {
        // Two subscribers: event mapping and heartbeat termination
        Flux<StreamEvent> shared = events.publish().autoConnect(2);
        Flux<ServerSentEvent<String>> dataEvents = shared.map(this::toServerSentEvent);
        return Flux.merge(dataEvents, heartbeats(shared));
    }

    /**
     * Maps one orchestrator event.
     */
    public ServerSentEvent<String> toServerSentEvent(StreamEvent event) {
        if (event instanceof StreamEvent.Token token) {
            return build(EVENT_TEXT, jsonSerialize(new ChunkPayload(token.text())));
        }
        if (event instanceof StreamEvent.Notice notice) {
            return build(EVENT_STATUS, jsonSerialize(NoticePayload.from(notice.notice())));
        }
        if (event instanceof StreamEvent.Completed completed) {
            return build(EVENT_DONE, jsonSerialize(summary(completed.response())));
        }
        StreamEvent.Failed failed = (StreamEvent.Failed) event;
        STREAM_ERROR_COUNTER.increment();
        return build(EVENT_ERROR, errorJson(new StreamErrorPayload(ApiErrorResponse.from(failed.error()), failed.partial())));
    }

    /**
     * Serializes an object to JSON for SSE data payloads.
     *
     * @param objectToSerialize object to serialize
     * @return JSON string representation
     * @throws IllegalStateException if serialization fails
     */
    public String jsonSerialize(Object objectToSerialize) {
        try {
            return jsonWriter.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE data", e);
        }
    }

    /**
     * Creates a heartbeat Flux that emits SSE comments at regular intervals.
     *
     * @param terminateOn Flux that signals when heartbeats should stop
     * @return Flux of SSE comment events for keepalive
     */
    public Flux<ServerSentEvent<String>> heartbeats(Flux<?> terminateOn) {
        return Flux.interval(Duration.ofSeconds(HEARTBEAT_INTERVAL_SECONDS))
                .onBackpressureDrop()
                .takeUntilOther(terminateOn.ignoreElements())
                .map(tick -> ServerSentEvent.<String>builder().comment(COMMENT_KEEPALIVE).build());
    }

    private String errorJson(StreamErrorPayload payload) {
        try {
            return jsonWriter.writeValueAsString(payload);
        } catch (JsonProcessingException serializationFailure) {
            // terminal path, nowhere further to propagate
            log.error("Failed to serialize SSE error payload", serializationFailure);
            return ERROR_FALLBACK_JSON;
        }
    }

    private static ApiCompletionResponse summary(CompletionResponse response) {
        // text already went out as chunks
        ApiCompletionResponse full = ApiCompletionResponse.from(response);
        return new ApiCompletionResponse(full.status(), full.requestId(), "", full.provider(), full.model(),
                full.costCents(), full.cacheHit(), full.latencyMillis());
    }

    private static ServerSentEvent<String> build(String eventType, String json) {
        return ServerSentEvent.<String>builder().event(eventType).data(json).build();
    }

    /** Payload record for text chunks. */
    public record ChunkPayload(String text) {}

    /** Payload record for fallback notices. */
    public record NoticePayload(
            String message, String code, boolean retryable, String provider, int attempt, int maxAttempts) {

        static NoticePayload from(StreamingNotice notice) {
            return new NoticePayload(notice.summary(), notice.code(), notice.retryable(),
                    notice.provider(), notice.attempt(), notice.maxAttempts());
        }
    }

    /** Payload record for the trailing error marker. */
    public record StreamErrorPayload(ApiErrorResponse error, boolean partial) {}
}
