package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Event submitted over HTTP. {@code id} and {@code timestamp} (epoch millis)
 * are assigned by the server when omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventSubmissionRequest {
    private String id;
    private String pluginId;
    private String action;
    private String type;
    private String content;
    private Long timestamp;
    private String user;
    private String platform;
    private Map<String, Object> metadata;
}
