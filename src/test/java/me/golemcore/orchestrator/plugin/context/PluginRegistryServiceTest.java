package me.golemcore.orchestrator.plugin.context;

import me.golemcore.orchestrator.capability.CapabilityRegistration;
import me.golemcore.orchestrator.domain.exception.DuplicateRegistrationException;
import me.golemcore.orchestrator.domain.exception.UnknownStepException;
import me.golemcore.orchestrator.domain.model.PipelineStep;
import me.golemcore.orchestrator.plugin.api.ActionDescriptor;
import me.golemcore.orchestrator.plugin.api.ActionResult;
import me.golemcore.orchestrator.plugin.api.PluginAction;
import me.golemcore.orchestrator.plugin.api.PluginContext;
import me.golemcore.orchestrator.plugin.builtin.AbstractPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class PluginRegistryServiceTest {

    private PluginRegistryService registry;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistryService();
    }

    @Test
    void shouldLookupRegisteredAction() {
        registry.register(new TestPlugin("text", List.of(), "receive", "reply"));

        PluginAction action = registry.lookup("text", "reply");

        assertNotNull(action);
        assertEquals("reply", action.name());
        assertTrue(registry.contains(PipelineStep.of("text", "receive")));
    }

    @Test
    void shouldRejectDuplicatePluginId() {
        registry.register(new TestPlugin("text", List.of(), "a"));

        assertThrows(DuplicateRegistrationException.class,
                () -> registry.register(new TestPlugin("text", List.of(), "b")));
        assertEquals(1, registry.listPlugins().size());
    }

    @Test
    void shouldFailLookupForUnknownPluginOrAction() {
        registry.register(new TestPlugin("text", List.of(), "a"));

        UnknownStepException unknownAction = assertThrows(UnknownStepException.class,
                () -> registry.lookup("text", "missing"));
        assertEquals(PipelineStep.of("text", "missing"), unknownAction.getStep());
        assertThrows(UnknownStepException.class, () -> registry.lookup("other", "a"));
        assertFalse(registry.contains(PipelineStep.of("other", "a")));
    }

    @Test
    void shouldRunInitHooksInRegistrationOrderAfterAllRegistered() {
        List<String> order = new ArrayList<>();
        TestPlugin first = new TestPlugin("first", order, "a");
        TestPlugin second = new TestPlugin("second", order, "a");
        registry.register(first);
        registry.register(second);

        registry.initializePlugins(mock(PluginContext.class));

        assertEquals(List.of("first saw 2", "second saw 2"), order);
    }

    @Test
    void shouldListStepsAndCapabilityProvidersInRegistrationOrder() {
        TestPlugin text = new TestPlugin("text", List.of(), "receive", "reply");
        text.provide(CapabilityRegistration.of("echo", (input, config) -> CompletableFuture.completedFuture(input)));
        registry.register(text);
        registry.register(new TestPlugin("audit", List.of(), "log"));

        List<AvailableStep> steps = registry.availableSteps();

        assertEquals(List.of(PipelineStep.of("text", "receive"), PipelineStep.of("text", "reply"),
                PipelineStep.of("audit", "log")), steps.stream().map(AvailableStep::step).toList());
        assertEquals(1, registry.listCapabilityProviders().size());
        assertEquals("echo", registry.listCapabilityProviders().get(0).id());
    }

    @Test
    void shouldRejectRegistrationAfterFreeze() {
        registry.register(new TestPlugin("text", List.of(), "a"));
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register(new TestPlugin("late", List.of(), "a")));
        assertNotNull(registry.lookup("text", "a"));
    }

    private final class TestPlugin extends AbstractPlugin {

        private final List<String> initOrder;

        TestPlugin(String id, List<String> initOrder, String... actions) {
            super(id, id, "test plugin");
            this.initOrder = initOrder;
            for (String action : actions) {
                addAction(ActionDescriptor.builder().name(action).description(action).build(),
                        context -> ActionResult.empty());
            }
        }

        void provide(CapabilityRegistration registration) {
            addCapability(registration);
        }

        @Override
        public void init(PluginContext context) {
            initOrder.add(descriptor().id() + " saw " + registry.listPlugins().size());
        }
    }
}
