package me.golemcore.orchestrator.domain.model;

/**
 * Terminal outcome of an executor run.
 */
public enum RunStatus {
    SUCCESS, FAILURE
}
