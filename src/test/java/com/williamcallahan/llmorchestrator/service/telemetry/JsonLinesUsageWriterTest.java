package com.williamcallahan.llmorchestrator.service.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.llmorchestrator.domain.UsageRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies day-partitioned JSON lines output for usage records.
 */
class JsonLinesUsageWriterTest {

    @TempDir
    Path usageDirectory;

    @Test
    void write_appendsOneLinePerRecordToDailyFiles() throws IOException {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        JsonLinesUsageWriter writer = new JsonLinesUsageWriter(usageDirectory.resolve("usage"), objectMapper);
        UUID lateRequest = UUID.randomUUID();

        writer.write(List.of(
                new UsageRecord(UUID.randomUUID(), "openai", 4, Instant.parse("2025-03-15T08:00:00Z"), false),
                new UsageRecord(lateRequest, "anthropic", 0, Instant.parse("2025-03-15T23:59:59Z"), true),
                new UsageRecord(UUID.randomUUID(), "openai", 7, Instant.parse("2025-03-16T00:00:01Z"), false)));
        writer.write(List.of(
                new UsageRecord(UUID.randomUUID(), "openai", 1, Instant.parse("2025-03-16T10:00:00Z"), false)));

        List<String> firstDay = Files.readAllLines(
                writer.fileFor(LocalDate.parse("2025-03-15")), StandardCharsets.UTF_8);
        List<String> secondDay = Files.readAllLines(
                writer.fileFor(LocalDate.parse("2025-03-16")), StandardCharsets.UTF_8);

        assertEquals(2, firstDay.size());
        assertEquals(2, secondDay.size());
        JsonNode cacheHit = objectMapper.readTree(firstDay.get(1));
        assertEquals(lateRequest.toString(), cacheHit.get("requestId").asText());
        assertTrue(cacheHit.get("cacheHit").asBoolean());
        assertEquals(0, cacheHit.get("costCents").asLong());
    }

    @Test
    void write_skipsEmptyBatchWithoutCreatingDirectory() throws IOException {
        Path target = usageDirectory.resolve("never-created");
        new JsonLinesUsageWriter(target, new ObjectMapper()).write(List.of());

        assertFalse(Files.exists(target));
    }
}
