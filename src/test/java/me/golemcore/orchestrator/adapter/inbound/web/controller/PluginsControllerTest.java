package me.golemcore.orchestrator.adapter.inbound.web.controller;

import me.golemcore.orchestrator.adapter.inbound.web.dto.CapabilityDto;
import me.golemcore.orchestrator.adapter.inbound.web.dto.PluginDto;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.plugin.builtin.conversation.ConversationPlugin;
import me.golemcore.orchestrator.plugin.context.PluginRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginsControllerTest {

    private PluginRegistryService registry;
    private CapabilityRouter router;
    private PluginsController controller;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistryService();
        router = new CapabilityRouter(new OrchestratorProperties());
        controller = new PluginsController(registry, router);
    }

    @Test
    void shouldListPluginsWithDeclaredActions() {
        registry.register(new ConversationPlugin());

        StepVerifier.create(controller.listPlugins())
                .assertNext(response -> {
                    List<PluginDto> plugins = response.getBody();
                    assertEquals(1, plugins.size());
                    PluginDto plugin = plugins.get(0);
                    assertEquals("conversation", plugin.getId());
                    assertEquals(Set.of("chat"), plugin.getRequiredCapabilities());
                    assertEquals(List.of("respond", "remember"),
                            plugin.getActions().stream().map(PluginDto.ActionDto::getName).toList());
                    assertTrue(plugin.getActions().get(0).getAppends().contains("response"));
                })
                .verifyComplete();
    }

    @Test
    void shouldListCapabilitiesWithAliases() {
        router.registerCapability("llm-chat", Set.of("chat", "llm"),
                (input, config) -> CompletableFuture.completedFuture("ok"));

        StepVerifier.create(controller.listCapabilities())
                .assertNext(response -> {
                    List<CapabilityDto> capabilities = response.getBody();
                    assertEquals(1, capabilities.size());
                    assertEquals("llm-chat", capabilities.get(0).getId());
                    assertEquals(Set.of("chat", "llm"), capabilities.get(0).getAliases());
                })
                .verifyComplete();
    }
}
