package me.golemcore.orchestrator.domain.model;

/**
 * Extension fields of an {@code error} item. Step coordinates are null for
 * failures raised before any step ran (planning).
 */
public record ErrorPayload(FailureKind kind, String stepPluginId, String stepAction, String detail)
        implements ContextPayload {

    public static ErrorPayload forStep(FailureKind kind, PipelineStep step, String detail) {
        return new ErrorPayload(kind, step.pluginId(), step.action(), detail);
    }

    public static ErrorPayload forRun(FailureKind kind, String detail) {
        return new ErrorPayload(kind, null, null, detail);
    }

    @Override
    public String itemType() {
        return ContextItemTypes.ERROR;
    }
}
