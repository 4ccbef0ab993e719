package com.logsentinel.core.scoring;

/**
 * Isolation-style artifact: a decision value below zero marks the input as
 * anomalous.
 *
 * @since 1.0.0
 */
public interface AnomalyScoreModel extends ScoringArtifact {

    /** Label for anomalous inputs. */
    int ANOMALOUS = -1;

    /** Label for normal inputs. */
    int NORMAL = 1;

    /**
     * @param input features in {@link #getFeatureNames()} order
     * @return decision value; negative means anomalous
     */
    double decisionFunction(double[] input);

    /**
     * @param input features in {@link #getFeatureNames()} order
     * @return {@link #ANOMALOUS} or {@link #NORMAL}
     */
    default int predictLabel(double[] input) {
        return decisionFunction(input) < 0 ? ANOMALOUS : NORMAL;
    }
}
