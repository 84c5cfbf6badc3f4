package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResultDto {
    private String eventId;
    private String conversationKey;
    private String status;
    private int executedSteps;
    private String failureKind;
    private String failureDetail;
    private List<ContextItemDto> chain;
}
