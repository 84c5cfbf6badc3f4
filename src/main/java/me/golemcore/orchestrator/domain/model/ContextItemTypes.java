package me.golemcore.orchestrator.domain.model;

/**
 * Well-known {@link ContextItem} type tags. The tag set is open: plugins may
 * append items with any tag, downstream consumers interpret it.
 */
public final class ContextItemTypes {

    private ContextItemTypes() {
    }

    /** Seed item derived from a user-originated event. {@link UserInputPayload}. */
    public static final String USER_INPUT = "user_input";

    /** Seed item derived from a scheduled trigger. No payload. */
    public static final String TRIGGER = "trigger";

    /** Failure record for a step or the planner. {@link ErrorPayload}. */
    public static final String ERROR = "error";

    /** Generated answer text. {@link ResponsePayload}. */
    public static final String RESPONSE = "response";

    /** Schema-validated structured value, JSON content. {@link ExtractionPayload}. */
    public static final String EXTRACTION = "extraction";
}
