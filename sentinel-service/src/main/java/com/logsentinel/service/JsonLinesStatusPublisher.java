package com.logsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.JsonMappers;
import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.StatusPublisher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link StatusPublisher} appending {@code {"key": ..., "value": {...}}}
 * lines to a file, the last line per key being the current value.
 * Failures surface as {@link UncheckedIOException}; callers log and carry on.
 */
public class JsonLinesStatusPublisher implements StatusPublisher {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesStatusPublisher(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = JsonMappers.create();
    }

    @Override
    public synchronized void publish(String key, StatusRecord record) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("key", key);
        line.put("value", record.toMap());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(mapper.writeValueAsString(line));
                w.write('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write status for " + key + " to " + file, e);
        }
    }
}
