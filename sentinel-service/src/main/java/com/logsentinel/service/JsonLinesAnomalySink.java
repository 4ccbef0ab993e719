package com.logsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.JsonMappers;
import com.logsentinel.core.port.AnomalySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link AnomalySink} appending one JSON object per anomaly to a file.
 * Writes are serialised; every call opens, appends and closes the file.
 */
public class JsonLinesAnomalySink implements AnomalySink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesAnomalySink.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesAnomalySink(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = JsonMappers.create();
    }

    @Override
    public synchronized void persistAnomaly(Anomaly anomaly) throws IOException {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        String line = mapper.writeValueAsString(anomaly);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            w.write(line);
            w.write('\n');
        }
        LOG.info("Anomaly {} (severity {}) for {} from agent [{}]", anomaly.getAnomalyType(),
                anomaly.getSeverity(), anomaly.getEntityId(), anomaly.getSourceAgentId());
    }
}
