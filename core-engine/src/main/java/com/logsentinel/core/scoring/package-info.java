/**
 * Scoring artifacts: the in-memory form of trained model versions and the
 * loader for the {@code model.json} artifact file.
 *
 * @since 1.0.0
 */
package com.logsentinel.core.scoring;
