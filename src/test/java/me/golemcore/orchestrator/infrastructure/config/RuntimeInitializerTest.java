package me.golemcore.orchestrator.infrastructure.config;

import me.golemcore.orchestrator.capability.CapabilityRegistration;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.capability.StructuredExtractionService;
import me.golemcore.orchestrator.domain.exception.CapabilityConflictException;
import me.golemcore.orchestrator.domain.exception.DuplicateRegistrationException;
import me.golemcore.orchestrator.domain.model.PipelineStep;
import me.golemcore.orchestrator.domain.service.EventQueueService;
import me.golemcore.orchestrator.plugin.api.OrchestratorPlugin;
import me.golemcore.orchestrator.plugin.api.PluginContext;
import me.golemcore.orchestrator.plugin.builtin.AbstractPlugin;
import me.golemcore.orchestrator.plugin.builtin.BuiltinPluginCatalog;
import me.golemcore.orchestrator.plugin.context.PluginRegistryService;
import me.golemcore.orchestrator.port.outbound.MemoryPort;
import me.golemcore.orchestrator.port.outbound.ModelProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RuntimeInitializerTest {

    private PluginRegistryService registry;
    private CapabilityRouter router;
    private PluginContext pluginContext;
    private EventQueueService eventQueueService;
    private BuiltinPluginCatalog catalog;
    private List<String> initOrder;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistryService();
        router = new CapabilityRouter(new OrchestratorProperties());
        pluginContext = mock(PluginContext.class);
        eventQueueService = mock(EventQueueService.class);
        catalog = mock(BuiltinPluginCatalog.class);
        initOrder = new ArrayList<>();
    }

    @Test
    void shouldRegisterEverythingThenInitializeFreezeAndStartQueue() {
        when(catalog.createPlugins()).thenReturn(List.of(new RecordingPlugin("builtin", null)));
        RecordingPlugin bean = new RecordingPlugin("bean", "embedding");

        initializer(List.of(provider(true, "chat")), List.of(bean)).initialize();

        assertEquals(List.of("builtin", "bean"),
                registry.listPlugins().stream().map(p -> p.descriptor().id()).toList());
        assertEquals(List.of("builtin", "bean"), initOrder);
        assertTrue(router.isRegistered("chat"));
        assertTrue(router.isRegistered("embedding"));
        assertTrue(registry.isFrozen());
        assertTrue(router.isFrozen());
        verify(eventQueueService).start();
    }

    @Test
    void shouldSkipUnavailableModelProviders() {
        when(catalog.createPlugins()).thenReturn(List.of());
        ModelProviderPort provider = provider(false, "chat");

        initializer(List.of(provider), List.of()).initialize();

        assertFalse(router.isRegistered("chat"));
        verify(provider, never()).capabilities();
        verify(eventQueueService).start();
    }

    @Test
    void shouldAbortOnCapabilityConflictWithoutStartingQueue() {
        when(catalog.createPlugins()).thenReturn(List.of());
        RecordingPlugin clashing = new RecordingPlugin("clash", "chat");

        RuntimeInitializer initializer = initializer(List.of(provider(true, "chat")), List.of(clashing));

        assertThrows(CapabilityConflictException.class, initializer::initialize);
        assertTrue(initOrder.isEmpty());
        verify(eventQueueService, never()).start();
    }

    @Test
    void shouldAbortOnDuplicatePluginId() {
        when(catalog.createPlugins()).thenReturn(List.of(new RecordingPlugin("same", null)));

        RuntimeInitializer initializer = initializer(List.of(), List.of(new RecordingPlugin("same", null)));

        assertThrows(DuplicateRegistrationException.class, initializer::initialize);
        verify(eventQueueService, never()).start();
    }

    @Test
    void shouldStartEvenWhenRequiredCapabilityIsMissing() {
        when(catalog.createPlugins()).thenReturn(List.of());
        RecordingPlugin needy = new RecordingPlugin("needy", null, "vision");

        initializer(List.of(), List.of(needy)).initialize();

        assertEquals(List.of("needy"), initOrder);
        verify(eventQueueService).start();
    }

    @Test
    void shouldInitializeBuiltinCatalog() {
        when(pluginContext.requireService(CapabilityRouter.class)).thenReturn(router);
        when(pluginContext.requireService(MemoryPort.class)).thenReturn(mock(MemoryPort.class));
        when(pluginContext.requireService(StructuredExtractionService.class))
                .thenReturn(mock(StructuredExtractionService.class));
        when(pluginContext.pluginConfig("conversation")).thenReturn(Map.of());

        new RuntimeInitializer(List.of(provider(true, "chat")), List.of(), new BuiltinPluginCatalog(), registry,
                router, pluginContext, eventQueueService).initialize();

        assertTrue(registry.contains(PipelineStep.of("conversation", "respond")));
        assertTrue(registry.contains(PipelineStep.of("intent", "classify")));
        verify(pluginContext).requireService(StructuredExtractionService.class);
    }

    private RuntimeInitializer initializer(List<ModelProviderPort> providers, List<OrchestratorPlugin> beans) {
        return new RuntimeInitializer(providers, beans, catalog, registry, router, pluginContext,
                eventQueueService);
    }

    private static ModelProviderPort provider(boolean available, String capability) {
        ModelProviderPort provider = mock(ModelProviderPort.class);
        when(provider.getProviderId()).thenReturn("test-provider");
        when(provider.isAvailable()).thenReturn(available);
        when(provider.capabilities()).thenReturn(List.of(CapabilityRegistration.of(capability,
                (input, config) -> CompletableFuture.completedFuture("ok"))));
        return provider;
    }

    private final class RecordingPlugin extends AbstractPlugin {

        RecordingPlugin(String id, String providedCapability, String... required) {
            super(id, id, "recording plugin", required);
            if (providedCapability != null) {
                addCapability(CapabilityRegistration.of(providedCapability,
                        (input, config) -> CompletableFuture.completedFuture(id)));
            }
        }

        @Override
        public void init(PluginContext context) {
            initOrder.add(descriptor().id());
        }
    }
}
