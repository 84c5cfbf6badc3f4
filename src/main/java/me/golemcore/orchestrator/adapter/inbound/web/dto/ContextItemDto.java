package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextItemDto {
    private String id;
    private String pluginId;
    private String action;
    private String type;
    private String content;
    private Instant createdAt;
    private Object payload;
}
