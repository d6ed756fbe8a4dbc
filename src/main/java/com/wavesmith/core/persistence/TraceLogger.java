package com.wavesmith.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit log for one goal. Each line holds an ISO-8601
 * {@code timestamp}, an {@code event} name and a free-form {@code payload}.
 */
public class TraceLogger {

    private static final Logger log = LoggerFactory.getLogger(TraceLogger.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    TraceLogger(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getPath() {
        return path;
    }

    public synchronized void log(String event, Map<String, Object> payload) {
        var entry = new TraceEntry(Instant.now(), event, payload);
        try {
            Files.createDirectories(path.getParent());
            String line = objectMapper.writeValueAsString(entry) + "\n";
            Files.write(path, line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append trace event " + event, e);
        }
        log.debug("Trace {}: {}", event, payload);
    }

    public List<TraceEntry> readAll() {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<TraceEntry> entries = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(objectMapper.readValue(line, TraceEntry.class));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read trace " + path, e);
        }
        return entries;
    }

    public record TraceEntry(Instant timestamp, String event, Map<String, Object> payload) {}
}
