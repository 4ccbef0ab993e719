package com.logsentinel.core.scoring;

/**
 * Artifact that outputs the probability of the positive (anomalous) class.
 *
 * @since 1.0.0
 */
public interface ProbabilityModel extends ScoringArtifact {

    /**
     * @param input features in {@link #getFeatureNames()} order
     * @return probability in {@code [0, 1]}
     */
    double predictProbability(double[] input);
}
