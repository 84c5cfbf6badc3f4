package me.golemcore.orchestrator.domain.model;

/**
 * Failure classification shared by exceptions and error context items.
 */
public enum FailureKind {

    /** Malformed event submission, rejected before queueing. */
    INVALID_EVENT,

    DUPLICATE_REGISTRATION,

    CAPABILITY_CONFLICT,

    /** Step references a plugin action that is not registered. */
    UNKNOWN_STEP,

    UNKNOWN_CAPABILITY,

    /** Planning capability failed or returned an invalid plan. */
    PLANNING_ERROR,

    CAPABILITY_TIMEOUT,

    /** Capability handler raised an error. */
    CAPABILITY_FAILURE,

    /** Structured extraction exhausted its attempts. */
    EXTRACTION_FAILED,

    /** Plugin action handler failed. */
    STEP_FAILURE,

    /** Run executed more steps than allowed. */
    STEP_LIMIT
}
