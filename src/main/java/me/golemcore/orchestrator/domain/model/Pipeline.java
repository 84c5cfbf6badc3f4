package me.golemcore.orchestrator.domain.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Ordered steps still to run in one executor run. The not-yet-executed tail can
 * be replaced wholesale; already executed steps are gone.
 */
public final class Pipeline {

    private final Deque<PipelineStep> remaining;

    private Pipeline(List<PipelineStep> steps) {
        this.remaining = new ArrayDeque<>(steps);
    }

    public static Pipeline of(List<PipelineStep> steps) {
        return new Pipeline(steps != null ? steps : List.of());
    }

    public static Pipeline empty() {
        return new Pipeline(List.of());
    }

    public Optional<PipelineStep> next() {
        return Optional.ofNullable(remaining.pollFirst());
    }

    public List<PipelineStep> remaining() {
        return List.copyOf(remaining);
    }

    public void replaceRemaining(List<PipelineStep> steps) {
        remaining.clear();
        remaining.addAll(steps);
    }

    public boolean isEmpty() {
        return remaining.isEmpty();
    }

    public int size() {
        return remaining.size();
    }
}
