package com.logsentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.JsonMappers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonLinesAnomalySink}.
 */
class JsonLinesAnomalySinkTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Each anomaly should be appended as one JSON line")
    void shouldAppendLines() throws Exception {
        Path out = tempDir.resolve("out/anomalies.jsonl");
        JsonLinesAnomalySink sink = new JsonLinesAnomalySink(out);

        sink.persistAnomaly(anomaly("ap-1", 5));
        sink.persistAnomaly(anomaly("ap-2", 3));

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(2);
        ObjectMapper mapper = JsonMappers.create();
        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("entityId").asText()).isEqualTo("ap-1");
        assertThat(first.get("severity").asInt()).isEqualTo(5);
        assertThat(first.get("timestamp").asText()).isEqualTo("2026-03-01T12:00:00Z");
        assertThat(mapper.readValue(lines.get(1), Anomaly.class).getEntityId()).isEqualTo("ap-2");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Anomaly anomaly(String entity, int severity) {
        return Anomaly.builder()
                .timestamp(Instant.parse("2026-03-01T12:00:00Z"))
                .entityId(entity)
                .anomalyType("auth_failure")
                .severity(severity)
                .confidence(0.9)
                .description("Authentication failures")
                .features(Map.of("authFailures", 12.0))
                .sourceAgentId("wifi")
                .build();
    }
}
