package com.logsentinel.core.scoring;

import com.logsentinel.core.model.FeatureVector;

import java.util.List;

/**
 * In-memory form of a trained model version.
 *
 * <p>
 * An artifact is usable for detection only when it also implements
 * {@link ProbabilityModel} or {@link AnomalyScoreModel}. Implementations are
 * immutable once loaded, so one instance can be shared by every agent that
 * reads it.
 * </p>
 *
 * @since 1.0.0
 */
public interface ScoringArtifact {

    /**
     * @return the {@code format} discriminator of the artifact file
     */
    String getFormat();

    /**
     * @return model input order; may be empty for artifacts without inputs
     */
    List<String> getFeatureNames();

    /**
     * @return {@code true} if the artifact exposes a predict-equivalent
     *         capability
     */
    default boolean hasPredictCapability() {
        return this instanceof ProbabilityModel || this instanceof AnomalyScoreModel;
    }

    /**
     * Lay a feature vector out in this artifact's input order. Features the
     * vector lacks read as {@code 0}.
     *
     * @param vector source features
     * @return model input
     */
    default double[] toInput(FeatureVector vector) {
        List<String> names = getFeatureNames();
        double[] input = new double[names.size()];
        for (int i = 0; i < input.length; i++) {
            input[i] = vector.getOrZero(names.get(i));
        }
        return input;
    }
}
