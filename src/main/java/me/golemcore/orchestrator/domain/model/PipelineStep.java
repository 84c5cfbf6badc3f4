package me.golemcore.orchestrator.domain.model;

import java.util.Objects;

/**
 * Reference to a registered plugin action.
 */
public record PipelineStep(String pluginId, String action) {

    public PipelineStep {
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(action, "action");
    }

    public static PipelineStep of(String pluginId, String action) {
        return new PipelineStep(pluginId, action);
    }

    @Override
    public String toString() {
        return pluginId + "/" + action;
    }
}
