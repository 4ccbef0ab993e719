package com.logsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.JsonMappers;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.port.LogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link LogSource} over JSON-lines files: one {@link LogEntry} object per
 * line, read from a single file or from every {@code .jsonl}/{@code .json}
 * file of a directory.
 *
 * <p>
 * Malformed lines and lines without a timestamp are logged and skipped, so a
 * single bad record does not fail the cycle. Every fetch re-reads the files.
 * </p>
 */
public class JsonLinesLogSource implements LogSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesLogSource.class);

    private final Path path;
    private final ObjectMapper mapper;

    public JsonLinesLogSource(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = JsonMappers.create();
    }

    @Override
    public List<LogEntry> fetchLogs(Set<String> sourceFilters, Instant windowStart, Instant windowEnd)
            throws IOException {
        Objects.requireNonNull(windowStart, "windowStart must not be null");
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        List<LogEntry> out = new ArrayList<>();
        for (Path file : files()) {
            read(file, sourceFilters, windowStart, windowEnd, out);
        }
        LOG.debug("Fetched {} log(s) from {} for [{}, {}]", out.size(), path, windowStart, windowEnd);
        return out;
    }

    private List<Path> files() throws IOException {
        if (!Files.exists(path)) {
            LOG.debug("Log source {} does not exist yet", path);
            return List.of();
        }
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> list = Files.list(path)) {
            return list.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".jsonl") || name.endsWith(".json");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private void read(Path file, Set<String> sourceFilters, Instant windowStart, Instant windowEnd,
            List<LogEntry> out) throws IOException {
        int lineNo = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                LogEntry entry;
                try {
                    entry = mapper.readValue(line, LogEntry.class);
                } catch (JsonProcessingException e) {
                    LOG.warn("Skipping malformed log line {}:{}: {}", file, lineNo, e.getOriginalMessage());
                    continue;
                }
                Instant ts = entry.getTimestamp();
                if (ts == null) {
                    LOG.warn("Skipping log line {}:{} without timestamp", file, lineNo);
                    continue;
                }
                if (ts.isBefore(windowStart) || ts.isAfter(windowEnd)) {
                    continue;
                }
                if (sourceFilters != null && !sourceFilters.isEmpty()
                        && !entry.getProgram().map(sourceFilters::contains).orElse(false)) {
                    continue;
                }
                out.add(entry);
            }
        }
    }
}
