/**
 * Seams to the collaborators the core does not own: the log source, the
 * anomaly sink and the key-value status store.
 *
 * @since 1.0.0
 */
package com.logsentinel.core.port;
