package com.logsentinel.core.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.logsentinel.core.model.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the registry file ({@value #REGISTRY_FILE}) as one
 * document. Writes go to a temporary file that replaces the registry in a
 * single move.
 *
 * <p>
 * Not synchronized; the lifecycle manager serialises every call under its
 * registry lock.
 * </p>
 *
 * @since 1.0.0
 */
public class RegistryStore {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryStore.class);

    public static final String REGISTRY_FILE = "model_registry.json";

    private final Path file;
    private final ObjectMapper mapper;

    public RegistryStore(Path storeRoot) {
        this.file = Objects.requireNonNull(storeRoot, "storeRoot must not be null").resolve(REGISTRY_FILE);
        this.mapper = JsonMappers.create().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return version id to version in stored order; empty if the file does
     *         not exist yet
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public Map<String, ModelVersion> read() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            RegistryDocument doc = mapper.readValue(file.toFile(), RegistryDocument.class);
            Map<String, ModelVersion> versions = new LinkedHashMap<>();
            for (ModelVersion v : doc.getVersions()) {
                versions.put(v.getVersionId(), v);
            }
            LOG.debug("Read {} version(s) from {}", versions.size(), file);
            return versions;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model registry " + file, e);
        }
    }

    /**
     * Replace the stored registry.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void write(Map<String, ModelVersion> versions) {
        Objects.requireNonNull(versions, "versions must not be null");
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), REGISTRY_FILE, ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), new RegistryDocument(new ArrayList<>(versions.values())));
                try {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write model registry " + file, e);
        }
    }

    /** On-disk shape of the registry file. */
    static final class RegistryDocument {
        private final List<ModelVersion> versions;

        @JsonCreator
        RegistryDocument(@JsonProperty("versions") List<ModelVersion> versions) {
            this.versions = versions != null ? versions : Collections.emptyList();
        }

        public List<ModelVersion> getVersions() {
            return versions;
        }
    }
}
