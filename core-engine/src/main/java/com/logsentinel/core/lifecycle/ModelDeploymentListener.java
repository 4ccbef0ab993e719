package com.logsentinel.core.lifecycle;

/**
 * Notified after a version has been deployed or rolled back to a slot.
 * Called outside the registry lock, on the thread that performed the
 * operation.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModelDeploymentListener {

    void onModelDeployed(DeployedModel model);
}
