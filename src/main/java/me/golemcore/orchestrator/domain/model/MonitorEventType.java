package me.golemcore.orchestrator.domain.model;

/**
 * Observability events published to monitor sinks.
 */
public enum MonitorEventType {
    EVENT_SUBMITTED,
    RUN_STARTED,
    PLAN_ACCEPTED,
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    PIPELINE_REPLACED,
    REPLAN_FAILED,
    RUN_SUCCEEDED,
    RUN_FAILED
}
