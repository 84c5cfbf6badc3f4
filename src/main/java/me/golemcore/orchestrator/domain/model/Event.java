package me.golemcore.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Producer-supplied unit of work. One event produces exactly one executor run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    private static final String DEFAULT_PLATFORM = "default";
    private static final String SYNTHETIC_KEY_PREFIX = "event:";

    private String id;
    private String pluginId;
    private String action;
    private String type;
    private String content;
    private Instant timestamp;

    private String user;
    private String platform;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @JsonIgnore
    private ResponseHandler responseHandler;

    /**
     * Ordering/concurrency partition key: {@code platform:user} when a user is
     * known, otherwise a synthetic key unique to this event.
     */
    @JsonIgnore
    public String getConversationKey() {
        if (user != null && !user.isBlank()) {
            String resolvedPlatform = platform != null && !platform.isBlank() ? platform : DEFAULT_PLATFORM;
            return resolvedPlatform + ":" + user;
        }
        return SYNTHETIC_KEY_PREFIX + id;
    }
}
