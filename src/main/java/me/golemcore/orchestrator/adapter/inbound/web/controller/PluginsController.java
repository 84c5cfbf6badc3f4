package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.adapter.inbound.web.dto.CapabilityDto;
import me.golemcore.orchestrator.adapter.inbound.web.dto.PluginDto;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.plugin.api.ActionDescriptor;
import me.golemcore.orchestrator.plugin.api.OrchestratorPlugin;
import me.golemcore.orchestrator.plugin.context.PluginRegistryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/plugins")
@RequiredArgsConstructor
public class PluginsController {

    private final PluginRegistryService pluginRegistry;
    private final CapabilityRouter capabilityRouter;

    @GetMapping
    public Mono<ResponseEntity<List<PluginDto>>> listPlugins() {
        List<PluginDto> plugins = pluginRegistry.listPlugins().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(plugins));
    }

    @GetMapping("/capabilities")
    public Mono<ResponseEntity<List<CapabilityDto>>> listCapabilities() {
        List<CapabilityDto> capabilities = capabilityRouter.listCapabilityIds().stream()
                .map(id -> CapabilityDto.builder()
                        .id(id)
                        .aliases(capabilityRouter.aliasesOf(id))
                        .build())
                .toList();
        return Mono.just(ResponseEntity.ok(capabilities));
    }

    private PluginDto toDto(OrchestratorPlugin plugin) {
        return PluginDto.builder()
                .id(plugin.descriptor().id())
                .name(plugin.descriptor().name())
                .version(plugin.descriptor().version())
                .description(plugin.descriptor().description())
                .requiredCapabilities(plugin.requiredCapabilities())
                .actions(plugin.actions().values().stream()
                        .map(action -> toActionDto(action.descriptor()))
                        .toList())
                .build();
    }

    private PluginDto.ActionDto toActionDto(ActionDescriptor descriptor) {
        return PluginDto.ActionDto.builder()
                .name(descriptor.name())
                .description(descriptor.description())
                .reads(descriptor.reads())
                .appends(descriptor.appends())
                .exclusiveEffects(descriptor.exclusiveEffects())
                .build();
    }
}
