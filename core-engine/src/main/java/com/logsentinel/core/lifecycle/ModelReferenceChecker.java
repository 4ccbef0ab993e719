package com.logsentinel.core.lifecycle;

/**
 * Answers whether an active agent is assigned to a model version. Consulted
 * before a version is deleted.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModelReferenceChecker {

    /** Checker that never reports a reference. */
    ModelReferenceChecker NONE = versionId -> false;

    boolean isModelReferenced(String versionId);
}
