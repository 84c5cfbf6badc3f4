package me.golemcore.orchestrator.domain.model;

/**
 * What the executor does after a plugin handler fails.
 */
public enum StepFailurePolicy {

    /** Record the error item and terminate the run as failed. */
    HALT,

    /** Record the error item and continue with the next step. */
    SKIP
}
