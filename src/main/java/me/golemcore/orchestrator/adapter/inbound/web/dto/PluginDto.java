package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginDto {
    private String id;
    private String name;
    private String version;
    private String description;
    private Set<String> requiredCapabilities;
    private List<ActionDto> actions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionDto {
        private String name;
        private String description;
        private Set<String> reads;
        private Set<String> appends;
        private Set<String> exclusiveEffects;
    }
}
