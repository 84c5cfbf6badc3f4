package me.golemcore.orchestrator.domain.model;

/**
 * States of the pipeline executor state machine.
 */
public enum RunState {
    PLANNING, RUNNING, REPLANNING, SUCCEEDED, FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
