/**
 * Process wiring for Log Sentinel: environment configuration, JSON-lines
 * adapters for the core's log source, anomaly sink and status store, and
 * the {@code main} launcher.
 *
 * @since 1.0.0
 */
package com.logsentinel.service;
