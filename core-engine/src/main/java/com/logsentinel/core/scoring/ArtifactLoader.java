package com.logsentinel.core.scoring;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a {@code model.json} artifact file into a {@link ScoringArtifact}.
 *
 * <h3>Supported formats</h3>
 * <ul>
 * <li>{@code logistic_regression}: {@code featureNames}, {@code coefficients},
 * {@code intercept}</li>
 * <li>{@code random_cut_forest}: {@code featureNames}, optional
 * {@code scoreThreshold}, {@code forest} (serialized forest state)</li>
 * <li>{@code threshold_table}: {@code thresholds} (feature to value)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ArtifactLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactLoader.class);

    /** Artifact file name inside a bundle directory. */
    public static final String ARTIFACT_FILE = "model.json";

    private final ObjectMapper mapper;

    public ArtifactLoader() {
        this(JsonMappers.create());
    }

    public ArtifactLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Load an artifact from a bundle directory or directly from an artifact
     * file.
     *
     * @param path bundle directory or {@code model.json} path
     * @return the loaded artifact
     * @throws ModelLoadException if the file is missing, unreadable or
     *                            malformed
     */
    public ScoringArtifact load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path file = Files.isDirectory(path) ? path.resolve(ARTIFACT_FILE) : path;
        if (!Files.isRegularFile(file)) {
            throw new ModelLoadException("Artifact file not found: " + file);
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read artifact " + file + ": " + e.getMessage(), e);
        }
        ScoringArtifact artifact = parse(root, file);
        LOG.debug("Loaded {} artifact from {}", artifact.getFormat(), file);
        return artifact;
    }

    private ScoringArtifact parse(JsonNode root, Path file) {
        if (root == null || !root.isObject()) {
            throw new ModelLoadException("Artifact " + file + " is not a JSON object");
        }
        String format = text(root, "format", file).toLowerCase(Locale.ROOT);
        try {
            return switch (format) {
                case LogisticRegressionArtifact.FORMAT -> new LogisticRegressionArtifact(
                        featureNames(root, file), doubles(root, "coefficients", file),
                        number(root, "intercept", file));
                case RandomCutForestArtifact.FORMAT -> parseForest(root, file);
                case ThresholdTableArtifact.FORMAT -> new ThresholdTableArtifact(thresholds(root, file));
                default -> throw new ModelLoadException("Unsupported artifact format '" + format + "' in " + file);
            };
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException("Invalid artifact " + file + ": " + e.getMessage(), e);
        }
    }

    private RandomCutForestArtifact parseForest(JsonNode root, Path file) {
        JsonNode forestNode = root.get("forest");
        if (forestNode == null || !forestNode.isObject()) {
            throw new ModelLoadException("Artifact " + file + " is missing 'forest'");
        }
        double threshold = root.has("scoreThreshold")
                ? number(root, "scoreThreshold", file)
                : RandomCutForestArtifact.DEFAULT_SCORE_THRESHOLD;
        RandomCutForest forest;
        try {
            RandomCutForestState state = mapper.treeToValue(forestNode, RandomCutForestState.class);
            forest = new RandomCutForestMapper().toModel(state);
        } catch (JsonProcessingException e) {
            throw new ModelLoadException("Malformed forest state in " + file + ": " + e.getOriginalMessage(), e);
        } catch (RuntimeException e) {
            throw new ModelLoadException("Cannot restore forest from " + file + ": " + e, e);
        }
        return new RandomCutForestArtifact(featureNames(root, file), threshold, forest);
    }

    // ---------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------

    private static String text(JsonNode root, String field, Path file) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new ModelLoadException("Artifact " + file + " is missing '" + field + "'");
        }
        return node.asText();
    }

    private static double number(JsonNode root, String field, Path file) {
        JsonNode node = root.get(field);
        if (node == null || !node.isNumber()) {
            throw new ModelLoadException("Artifact " + file + " requires numeric '" + field + "'");
        }
        return node.asDouble();
    }

    private static List<String> featureNames(JsonNode root, Path file) {
        JsonNode node = root.get("featureNames");
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new ModelLoadException("Artifact " + file + " requires non-empty 'featureNames'");
        }
        List<String> names = new ArrayList<>(node.size());
        for (JsonNode n : node) {
            names.add(n.asText());
        }
        return names;
    }

    private static double[] doubles(JsonNode root, String field, Path file) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new ModelLoadException("Artifact " + file + " requires array '" + field + "'");
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            if (!node.get(i).isNumber()) {
                throw new ModelLoadException("Artifact " + file + " has a non-numeric entry in '" + field + "'");
            }
            values[i] = node.get(i).asDouble();
        }
        return values;
    }

    private static Map<String, Double> thresholds(JsonNode root, Path file) {
        JsonNode node = root.get("thresholds");
        if (node == null || !node.isObject()) {
            throw new ModelLoadException("Artifact " + file + " requires object 'thresholds'");
        }
        Map<String, Double> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue().asDouble());
        }
        return out;
    }
}
