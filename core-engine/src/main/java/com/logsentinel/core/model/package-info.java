/**
 * Domain model classes for Log Sentinel.
 *
 * <p>
 * Values passed between the log source, the detection pipeline and the
 * external sinks:
 * </p>
 * <ul>
 * <li>{@link com.logsentinel.core.model.LogEntry}: free-form device log
 * record</li>
 * <li>{@link com.logsentinel.core.model.FeatureVector}: per-entity numeric
 * features for one window</li>
 * <li>{@link com.logsentinel.core.model.Anomaly}: detected anomaly handed to
 * the sink</li>
 * <li>{@link com.logsentinel.core.model.StatusRecord}: lifecycle status
 * written to the status store</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.model;
