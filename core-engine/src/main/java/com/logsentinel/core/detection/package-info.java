/**
 * Anomaly classification over feature vectors.
 *
 * <p>
 * {@link com.logsentinel.core.detection.AnomalyClassifier} combines the rule
 * thresholds of a {@link com.logsentinel.core.detection.RuleTable} with an
 * optional scoring artifact. Default thresholds live in
 * {@link com.logsentinel.core.detection.DetectionDefaults}.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.detection;
