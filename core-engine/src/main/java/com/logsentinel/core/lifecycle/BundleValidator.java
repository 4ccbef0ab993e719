package com.logsentinel.core.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.JsonMappers;
import com.logsentinel.core.scoring.ArtifactLoader;
import com.logsentinel.core.scoring.ModelLoadException;
import com.logsentinel.core.scoring.ScoringArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a bundle directory before it may be imported or deployed.
 *
 * <h3>Errors</h3>
 * <ul>
 * <li>a required file ({@code model.json}, {@code metadata.json}) is
 * missing</li>
 * <li>metadata is malformed or lacks {@code modelInfo.version} or
 * {@code modelInfo.modelType}</li>
 * <li>a manifest file hash does not match, or a hashed file is missing</li>
 * <li>the artifact fails to load or exposes no predict capability</li>
 * </ul>
 *
 * <h3>Warnings</h3>
 * <ul>
 * <li>optional files or optional metadata fields missing</li>
 * <li>quality metrics below the floors (F1 0.5, ROC-AUC 0.6, precision 0.5,
 * recall 0.5)</li>
 * <li>metadata feature names differing from the artifact's</li>
 * <li>a model older than {@link #MAX_MODEL_AGE}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class BundleValidator {

    private static final Logger LOG = LoggerFactory.getLogger(BundleValidator.class);

    public static final String METADATA_FILE = "metadata.json";
    public static final String MANIFEST_FILE = "deployment_manifest.json";

    public static final List<String> REQUIRED_FILES = List.of(ArtifactLoader.ARTIFACT_FILE, METADATA_FILE);
    public static final List<String> OPTIONAL_FILES = List.of(
            MANIFEST_FILE, "README.md", "inference_example.py", "validate_model.py");

    public static final double MIN_F1 = 0.5;
    public static final double MIN_ROC_AUC = 0.6;
    public static final double MIN_PRECISION = 0.5;
    public static final double MIN_RECALL = 0.5;
    public static final Duration MAX_MODEL_AGE = Duration.ofDays(30);

    private final ArtifactLoader artifactLoader;
    private final ObjectMapper mapper;
    private final Clock clock;

    public BundleValidator(ArtifactLoader artifactLoader, Clock clock) {
        this.artifactLoader = Objects.requireNonNull(artifactLoader, "artifactLoader must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = JsonMappers.create();
    }

    /**
     * Report only the structural problems: bundle directory and required
     * files present. Used for imports that skip full validation.
     */
    public ValidationReport checkStructure(Path bundleDir) {
        ValidationReport.Builder report = ValidationReport.builder();
        checkFiles(bundleDir, report);
        return report.build(clock.instant());
    }

    /**
     * Run every check.
     *
     * @param bundleDir bundle directory
     * @return the report; never {@code null}
     */
    public ValidationReport validate(Path bundleDir) {
        Objects.requireNonNull(bundleDir, "bundleDir must not be null");
        ValidationReport.Builder report = ValidationReport.builder();
        if (!checkFiles(bundleDir, report)) {
            return finish(bundleDir, report);
        }

        Optional<ModelMetadata> metadata = readMetadata(bundleDir, report);
        metadata.ifPresent(m -> checkMetadata(m, report));
        checkManifest(bundleDir, report);

        ScoringArtifact artifact = null;
        try {
            artifact = artifactLoader.load(bundleDir);
            if (!artifact.hasPredictCapability()) {
                report.error("Artifact format '" + artifact.getFormat() + "' exposes no predict capability");
            }
        } catch (ModelLoadException e) {
            report.error("Artifact failed to load: " + e.getMessage());
        }

        if (artifact != null && metadata.isPresent()) {
            List<String> declared = metadata.get().getTrainingInfo() != null
                    ? metadata.get().getTrainingInfo().getFeatureNames()
                    : null;
            if (declared != null && !declared.isEmpty() && !declared.equals(artifact.getFeatureNames())) {
                report.warning("Metadata featureNames " + declared + " differ from artifact featureNames "
                        + artifact.getFeatureNames());
            }
        }
        return finish(bundleDir, report);
    }

    /**
     * Read {@code metadata.json} without validating it.
     *
     * @throws ModelLoadException if the file is missing or malformed
     */
    public ModelMetadata readMetadata(Path bundleDir) {
        Path file = bundleDir.resolve(METADATA_FILE);
        try {
            return mapper.readValue(file.toFile(), ModelMetadata.class);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read metadata " + file + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Checks
    // ---------------------------------------------------------------

    private ValidationReport finish(Path bundleDir, ValidationReport.Builder report) {
        ValidationReport result = report.build(clock.instant());
        if (result.isValid()) {
            LOG.debug("Bundle {} valid with {} warning(s)", bundleDir, result.getWarnings().size());
        } else {
            LOG.info("Bundle {} invalid: {}", bundleDir, result.getErrors());
        }
        return result;
    }

    private static boolean checkFiles(Path bundleDir, ValidationReport.Builder report) {
        if (!Files.isDirectory(bundleDir)) {
            report.error("Bundle directory not found: " + bundleDir);
            return false;
        }
        for (String required : REQUIRED_FILES) {
            if (!Files.isRegularFile(bundleDir.resolve(required))) {
                report.error("Missing required file: " + required);
            }
        }
        for (String optional : OPTIONAL_FILES) {
            if (!Files.isRegularFile(bundleDir.resolve(optional))) {
                report.warning("Missing optional file: " + optional);
            }
        }
        return !report.hasErrors();
    }

    private Optional<ModelMetadata> readMetadata(Path bundleDir, ValidationReport.Builder report) {
        try {
            return Optional.of(readMetadata(bundleDir));
        } catch (ModelLoadException e) {
            report.error("Malformed metadata: " + e.getMessage());
            return Optional.empty();
        }
    }

    private void checkMetadata(ModelMetadata metadata, ValidationReport.Builder report) {
        ModelMetadata.ModelInfo info = metadata.getModelInfo();
        if (info == null) {
            report.error("Missing required metadata section: modelInfo");
        } else {
            if (isBlank(info.getVersion())) {
                report.error("Missing required metadata field: modelInfo.version");
            }
            if (isBlank(info.getModelType())) {
                report.error("Missing required metadata field: modelInfo.modelType");
            }
            if (isBlank(info.getCreatedAt())) {
                report.warning("Missing metadata field: modelInfo.createdAt");
            } else {
                Optional<Instant> created = info.createdAtInstant();
                if (created.isEmpty()) {
                    report.warning("Unparseable modelInfo.createdAt: " + info.getCreatedAt());
                } else if (Duration.between(created.get(), clock.instant()).compareTo(MAX_MODEL_AGE) > 0) {
                    report.warning("Model is older than " + MAX_MODEL_AGE.toDays() + " days (created "
                            + created.get() + ")");
                }
            }
        }

        ModelMetadata.TrainingInfo training = metadata.getTrainingInfo();
        if (training == null || training.getFeatureNames() == null || training.getFeatureNames().isEmpty()) {
            report.warning("Missing metadata field: trainingInfo.featureNames");
        }
        if (training == null || training.getSampleCount() == null) {
            report.warning("Missing metadata field: trainingInfo.sampleCount");
        }

        Optional<ModelMetadata.BasicMetrics> metrics = metadata.basicMetrics();
        if (metrics.isEmpty()) {
            report.warning("Missing metadata field: evaluationInfo.basicMetrics");
            return;
        }
        ModelMetadata.BasicMetrics m = metrics.get();
        floor(report, "F1 score", m.getF1Score(), MIN_F1);
        floor(report, "ROC-AUC", m.getRocAuc(), MIN_ROC_AUC);
        floor(report, "Precision", m.getPrecision(), MIN_PRECISION);
        floor(report, "Recall", m.getRecall(), MIN_RECALL);
    }

    private static void floor(ValidationReport.Builder report, String name, Double value, double min) {
        if (value != null && value < min) {
            report.warning(String.format(Locale.ROOT, "Low %s: %.3f (minimum %.2f)", name, value, min));
        }
    }

    private void checkManifest(Path bundleDir, ValidationReport.Builder report) {
        Path manifest = bundleDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            return;
        }
        JsonNode root;
        try {
            root = mapper.readTree(manifest.toFile());
        } catch (IOException e) {
            report.error("Malformed deployment manifest: " + e.getMessage());
            return;
        }
        JsonNode hashes = root != null ? root.get("fileHashes") : null;
        if (hashes == null || !hashes.isObject()) {
            return;
        }
        Path base = bundleDir.toAbsolutePath().normalize();
        Iterator<Map.Entry<String, JsonNode>> it = hashes.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            Path target = base.resolve(entry.getKey()).normalize();
            if (!target.startsWith(base)) {
                report.error("Manifest entry escapes the bundle: " + entry.getKey());
                continue;
            }
            if (!Files.isRegularFile(target)) {
                report.error("Manifest lists missing file: " + entry.getKey());
                continue;
            }
            try {
                String actual = sha256(target);
                if (!actual.equalsIgnoreCase(entry.getValue().asText())) {
                    report.error("Hash mismatch for " + entry.getKey());
                }
            } catch (IOException e) {
                report.error("Cannot hash " + entry.getKey() + ": " + e.getMessage());
            }
        }
    }

    /**
     * @return lower-case hex SHA-256 of the file
     */
    public static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
