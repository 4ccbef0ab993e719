/**
 * Feature extraction: log batches to per-entity feature vectors.
 *
 * <p>
 * {@link com.logsentinel.core.features.FeatureExtractor} dispatches on field
 * presence to the registered {@link com.logsentinel.core.features.FeatureSet}
 * implementations (WiFi, DNS, firewall) and falls back to
 * {@link com.logsentinel.core.features.GenericFeatureSet}.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.features;
