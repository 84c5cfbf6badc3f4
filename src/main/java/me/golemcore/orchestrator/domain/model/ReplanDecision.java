package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Planner verdict after a step completes.
 */
public record ReplanDecision(Kind kind, List<PipelineStep> steps, String reason) {

    private static final ReplanDecision CONTINUE = new ReplanDecision(Kind.CONTINUE, List.of(), null);

    public ReplanDecision {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static ReplanDecision continueWithCurrent() {
        return CONTINUE;
    }

    public static ReplanDecision replace(List<PipelineStep> steps, String reason) {
        return new ReplanDecision(Kind.REPLACE, steps, reason);
    }

    public boolean isReplace() {
        return kind == Kind.REPLACE;
    }

    public enum Kind {
        CONTINUE, REPLACE
    }
}
