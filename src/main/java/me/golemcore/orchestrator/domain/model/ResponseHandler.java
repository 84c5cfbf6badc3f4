package me.golemcore.orchestrator.domain.model;

/**
 * Callback owned by the collaborator that submitted an event. Invoked exactly
 * once when the run terminates.
 */
@FunctionalInterface
public interface ResponseHandler {

    void onRunComplete(RunResult result);
}
