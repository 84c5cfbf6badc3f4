package me.golemcore.orchestrator.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Final state handed to the response handler. {@code chain} is an immutable
 * snapshot; {@code failure} is null on success.
 */
@Builder
public record RunResult(String eventId, String conversationKey, RunStatus status, List<ContextItem> chain,
        int executedSteps, ErrorPayload failure) {

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }
}
