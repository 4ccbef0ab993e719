package com.logsentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.logsentinel.core.model.JsonMappers;
import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.StatusPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesStatusPublisher}.
 */
class JsonLinesStatusPublisherTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Status records should be written as key/value lines")
    void shouldWriteKeyValueLines() throws Exception {
        Path file = tempDir.resolve("status.jsonl");
        JsonLinesStatusPublisher publisher = new JsonLinesStatusPublisher(file);

        publisher.publish(StatusPublisher.agentKey("wifi"), record("active"));
        publisher.publish(StatusPublisher.modelKey("v1"), record("deployed"));

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        JsonNode first = JsonMappers.create().readTree(lines.get(0));
        assertThat(first.get("key").asText()).isEqualTo("agent:wifi:status");
        assertThat(first.get("value").get("status").asText()).isEqualTo("active");
        assertThat(first.get("value").get("agentType").asText()).isEqualTo("rule_based");
        assertThat(lines.get(1)).contains("\"model:v1:status\"");
    }

    @Test
    @DisplayName("An unwritable target should surface as UncheckedIOException")
    void shouldFailOnUnwritableTarget() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        JsonLinesStatusPublisher publisher = new JsonLinesStatusPublisher(blocker.resolve("status.jsonl"));

        assertThatThrownBy(() -> publisher.publish("agent:wifi:status", record("active")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("agent:wifi:status");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static StatusRecord record(String status) {
        return new StatusRecord("wifi", status, Instant.parse("2026-03-01T12:00:00Z"),
                Map.of("agentType", "rule_based"));
    }
}
