package com.logsentinel.core.scoring;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Linear model with a logistic link: {@code p = 1 / (1 + exp(-(w . x + b)))}.
 *
 * @since 1.0.0
 */
public final class LogisticRegressionArtifact implements ProbabilityModel {

    public static final String FORMAT = "logistic_regression";

    private final List<String> featureNames;
    private final double[] coefficients;
    private final double intercept;

    /**
     * @throws IllegalArgumentException if coefficient and feature counts differ
     */
    public LogisticRegressionArtifact(List<String> featureNames, double[] coefficients, double intercept) {
        this.featureNames = List.copyOf(Objects.requireNonNull(featureNames, "featureNames must not be null"));
        Objects.requireNonNull(coefficients, "coefficients must not be null");
        if (coefficients.length != featureNames.size()) {
            throw new IllegalArgumentException("Expected " + featureNames.size()
                    + " coefficients, got " + coefficients.length);
        }
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    @Override
    public List<String> getFeatureNames() {
        return featureNames;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getIntercept() {
        return intercept;
    }

    @Override
    public double predictProbability(double[] input) {
        if (input.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length + " inputs, got " + input.length);
        }
        double z = intercept;
        for (int i = 0; i < input.length; i++) {
            z += coefficients[i] * input[i];
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public String toString() {
        return "LogisticRegressionArtifact{features=" + featureNames
                + ", coefficients=" + Arrays.toString(coefficients) + ", intercept=" + intercept + '}';
    }
}
