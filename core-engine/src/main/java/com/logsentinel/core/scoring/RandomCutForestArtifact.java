package com.logsentinel.core.scoring;

import com.amazon.randomcutforest.RandomCutForest;

import java.util.List;
import java.util.Objects;

/**
 * Isolation-style artifact backed by a Random Cut Forest.
 *
 * <p>
 * The decision value is {@code scoreThreshold - anomalyScore}, so inputs the
 * forest scores above the threshold come out negative (anomalous). The
 * forest is used read-only; it is never updated with scored points.
 * </p>
 *
 * @since 1.0.0
 */
public final class RandomCutForestArtifact implements AnomalyScoreModel {

    public static final String FORMAT = "random_cut_forest";

    /** Score above which the forest's output is treated as anomalous. */
    public static final double DEFAULT_SCORE_THRESHOLD = 1.0;

    private final List<String> featureNames;
    private final double scoreThreshold;
    private final RandomCutForest forest;

    /**
     * @throws IllegalArgumentException if the forest dimensions do not match
     *                                  the feature count
     */
    public RandomCutForestArtifact(List<String> featureNames, double scoreThreshold, RandomCutForest forest) {
        this.featureNames = List.copyOf(Objects.requireNonNull(featureNames, "featureNames must not be null"));
        this.forest = Objects.requireNonNull(forest, "forest must not be null");
        if (forest.getDimensions() != featureNames.size()) {
            throw new IllegalArgumentException("Forest has " + forest.getDimensions()
                    + " dimensions but " + featureNames.size() + " feature names");
        }
        if (!(scoreThreshold > 0)) {
            throw new IllegalArgumentException("scoreThreshold must be > 0, got: " + scoreThreshold);
        }
        this.scoreThreshold = scoreThreshold;
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    @Override
    public List<String> getFeatureNames() {
        return featureNames;
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    /**
     * @return {@code true} once the forest has seen enough samples to score
     */
    public boolean isOutputReady() {
        return forest.isOutputReady();
    }

    @Override
    public double decisionFunction(double[] input) {
        double score;
        synchronized (forest) {
            score = forest.getAnomalyScore(input);
        }
        return scoreThreshold - score;
    }

    @Override
    public String toString() {
        return "RandomCutForestArtifact{features=" + featureNames + ", scoreThreshold=" + scoreThreshold
                + ", trees=" + forest.getNumberOfTrees() + ", sampleSize=" + forest.getSampleSize() + '}';
    }
}
