package com.logsentinel.core.scoring;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logsentinel.core.model.FeatureVector;
import com.logsentinel.core.model.JsonMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ArtifactLoader}.
 */
class ArtifactLoaderTest {

    @TempDir
    Path tmp;

    private ArtifactLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ArtifactLoader();
    }

    @Test
    @DisplayName("Should load a logistic regression artifact from a bundle directory")
    void shouldLoadLogisticRegression() throws Exception {
        Files.writeString(tmp.resolve("model.json"), "{\"format\": \"logistic_regression\","
                + " \"featureNames\": [\"authFailures\", \"deauthCount\"],"
                + " \"coefficients\": [0.8, 0.1], \"intercept\": -3.5}");

        ScoringArtifact artifact = loader.load(tmp);

        assertThat(artifact).isInstanceOf(LogisticRegressionArtifact.class);
        assertThat(artifact.hasPredictCapability()).isTrue();
        assertThat(artifact.getFeatureNames()).containsExactly("authFailures", "deauthCount");
        double p = ((ProbabilityModel) artifact).predictProbability(new double[] {0, 0});
        assertThat(p).isCloseTo(1.0 / (1.0 + Math.exp(3.5)), within(1e-9));
    }

    @Test
    @DisplayName("Should lay out model input in artifact order with missing features as zero")
    void shouldBuildInputInFeatureOrder() throws Exception {
        Path file = tmp.resolve("artifact.json");
        Files.writeString(file, "{\"format\": \"logistic_regression\","
                + " \"featureNames\": [\"b\", \"a\", \"c\"], \"coefficients\": [1, 1, 1], \"intercept\": 0}");
        ScoringArtifact artifact = loader.load(file);

        FeatureVector vector = FeatureVector.of("ap-1", Instant.EPOCH, Map.of("a", 1.0, "b", 2.0));

        assertThat(artifact.toInput(vector)).containsExactly(2.0, 1.0, 0.0);
    }

    @Test
    @DisplayName("A threshold table should load but expose no predict capability")
    void shouldLoadThresholdTable() throws Exception {
        Files.writeString(tmp.resolve("model.json"),
                "{\"format\": \"threshold_table\", \"thresholds\": {\"queryCount\": 500}}");

        ScoringArtifact artifact = loader.load(tmp);

        assertThat(artifact).isInstanceOf(ThresholdTableArtifact.class);
        assertThat(((ThresholdTableArtifact) artifact).getThresholds()).containsEntry("queryCount", 500.0);
        assertThat(artifact.hasPredictCapability()).isFalse();
    }

    @Test
    @DisplayName("Should restore a serialized random cut forest and flag outliers")
    void shouldLoadRandomCutForest() throws Exception {
        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(2)
                .numberOfTrees(30)
                .sampleSize(64)
                .randomSeed(42L)
                .build();
        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            forest.update(new double[] {1.0 + random.nextGaussian() * 0.1, 1.0 + random.nextGaussian() * 0.1});
        }
        RandomCutForestMapper forestMapper = new RandomCutForestMapper();
        forestMapper.setSaveExecutorContextEnabled(true);

        ObjectMapper mapper = JsonMappers.create();
        ObjectNode root = mapper.createObjectNode();
        root.put("format", "random_cut_forest");
        root.putArray("featureNames").add("queryCount").add("nxdomainRatio");
        root.put("scoreThreshold", 1.2);
        root.set("forest", mapper.valueToTree(forestMapper.toState(forest)));
        mapper.writeValue(tmp.resolve("model.json").toFile(), root);

        ScoringArtifact artifact = loader.load(tmp);

        assertThat(artifact).isInstanceOf(RandomCutForestArtifact.class);
        RandomCutForestArtifact rcf = (RandomCutForestArtifact) artifact;
        assertThat(rcf.getScoreThreshold()).isEqualTo(1.2);
        assertThat(rcf.isOutputReady()).isTrue();
        double outlier = rcf.decisionFunction(new double[] {40.0, 40.0});
        double normal = rcf.decisionFunction(new double[] {1.0, 1.0});
        assertThat(outlier).isLessThan(normal);
        assertThat(rcf.predictLabel(new double[] {40.0, 40.0})).isEqualTo(AnomalyScoreModel.ANOMALOUS);
    }

    @Test
    @DisplayName("Should reject an unknown artifact format")
    void shouldRejectUnknownFormat() throws Exception {
        Files.writeString(tmp.resolve("model.json"), "{\"format\": \"pickle\"}");

        assertThatThrownBy(() -> loader.load(tmp))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Unsupported artifact format 'pickle'");
    }

    @Test
    @DisplayName("Should reject mismatched coefficient and feature counts")
    void shouldRejectCoefficientMismatch() throws Exception {
        Files.writeString(tmp.resolve("model.json"), "{\"format\": \"logistic_regression\","
                + " \"featureNames\": [\"a\", \"b\"], \"coefficients\": [1.0], \"intercept\": 0}");

        assertThatThrownBy(() -> loader.load(tmp))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Expected 2 coefficients");
    }

    @Test
    @DisplayName("Should reject a missing artifact file")
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> loader.load(tmp.resolve("absent")))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
        Files.writeString(tmp.resolve("model.json"), "{\"format\": ");

        assertThatThrownBy(() -> loader.load(tmp))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Failed to read artifact");
    }

    @Test
    @DisplayName("Logistic probability should stay within [0, 1] for extreme inputs")
    void shouldBoundProbability() {
        LogisticRegressionArtifact artifact = new LogisticRegressionArtifact(List.of("x"), new double[] {5.0}, 0);

        assertThat(artifact.predictProbability(new double[] {1e6})).isBetween(0.0, 1.0);
        assertThat(artifact.predictProbability(new double[] {-1e6})).isBetween(0.0, 1.0);
    }
}
