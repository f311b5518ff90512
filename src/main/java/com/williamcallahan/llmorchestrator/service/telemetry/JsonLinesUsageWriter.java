package com.williamcallahan.llmorchestrator.service.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmorchestrator.domain.UsageRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Appends usage records as JSON lines to one file per UTC day ({@code usage-2026-10-19.jsonl}).
 */
public class JsonLinesUsageWriter implements UsageWriter {
    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonLinesUsageWriter(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void write(List<UsageRecord> batch) throws IOException {
        if (batch.isEmpty()) {
            return;
        }
        Files.createDirectories(directory);
        Map<LocalDate, StringBuilder> linesByDay = new LinkedHashMap<>();
        for (UsageRecord usageRecord : batch) {
            LocalDate day = LocalDate.ofInstant(usageRecord.timestamp(), ZoneOffset.UTC);
            linesByDay.computeIfAbsent(day, unused -> new StringBuilder())
                    .append(objectMapper.writeValueAsString(usageRecord))
                    .append('\n');
        }
        for (Map.Entry<LocalDate, StringBuilder> dayLines : linesByDay.entrySet()) {
            try (BufferedWriter writer = Files.newBufferedWriter(
                    fileFor(dayLines.getKey()),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND)) {
                writer.write(dayLines.getValue().toString());
            }
        }
    }

    Path fileFor(LocalDate day) {
        return directory.resolve("usage-" + day + ".jsonl");
    }
}
