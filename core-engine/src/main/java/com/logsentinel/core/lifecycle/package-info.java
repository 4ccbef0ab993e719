/**
 * Model lifecycle: the versioned registry of scoring-artifact bundles,
 * bundle validation and the deploy/rollback state machine.
 *
 * <p>
 * {@link com.logsentinel.core.lifecycle.ModelLifecycleManager} is the only
 * writer of the registry; agents see deployed artifacts through immutable
 * {@link com.logsentinel.core.lifecycle.DeployedModel} snapshots.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.lifecycle;
