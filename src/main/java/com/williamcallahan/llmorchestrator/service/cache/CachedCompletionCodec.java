package com.williamcallahan.llmorchestrator.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes {@link CachedCompletion} to the byte payloads held by {@link ResponseCache}.
 */
public class CachedCompletionCodec {
    private static final Logger log = LoggerFactory.getLogger(CachedCompletionCodec.class);

    private final ObjectMapper objectMapper;

    public CachedCompletionCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public byte[] encode(CachedCompletion completion) {
        try {
            return objectMapper.writeValueAsBytes(completion);
        } catch (JsonProcessingException serializationFailure) {
            throw new IllegalStateException("Failed to serialize cached completion", serializationFailure);
        }
    }

    /**
     * Decodes a payload.
     *
     * @return the completion, or empty when the payload is unreadable
     */
    public Optional<CachedCompletion> decode(byte[] payload) {
        try {
            return Optional.of(objectMapper.readValue(payload, CachedCompletion.class));
        } catch (IOException readFailure) {
            log.warn("Discarding unreadable cache payload (sizeBytes={}, exceptionType={})",
                    payload.length, readFailure.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
