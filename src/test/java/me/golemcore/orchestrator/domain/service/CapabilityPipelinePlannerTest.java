package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.capability.JsonResponseReader;
import me.golemcore.orchestrator.domain.exception.PlanningException;
import me.golemcore.orchestrator.domain.exception.UnknownCapabilityException;
import me.golemcore.orchestrator.domain.model.ContextChain;
import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.ContextItemTypes;
import me.golemcore.orchestrator.domain.model.ConversationInteraction;
import me.golemcore.orchestrator.domain.model.Pipeline;
import me.golemcore.orchestrator.domain.model.PipelineStep;
import me.golemcore.orchestrator.domain.model.ReplanDecision;
import me.golemcore.orchestrator.domain.model.UserInputPayload;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.plugin.api.ActionDescriptor;
import me.golemcore.orchestrator.plugin.api.ActionResult;
import me.golemcore.orchestrator.plugin.builtin.AbstractPlugin;
import me.golemcore.orchestrator.plugin.context.PluginRegistryService;
import me.golemcore.orchestrator.port.outbound.MemoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CapabilityPipelinePlannerTest {

    private static final PipelineStep RECEIVE = PipelineStep.of("text", "receive");
    private static final PipelineStep REPLY = PipelineStep.of("text", "reply");

    private OrchestratorProperties properties;
    private CapabilityRouter router;
    private PluginRegistryService registry;
    private MemoryPort memoryPort;
    private CapabilityPipelinePlanner planner;
    private final List<String> prompts = new ArrayList<>();
    private final List<Map<String, Object>> configs = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        router = new CapabilityRouter(properties);
        registry = new PluginRegistryService();
        registry.register(new TextPlugin());
        memoryPort = mock(MemoryPort.class);
        planner = new CapabilityPipelinePlanner(router, registry, memoryPort,
                new JsonResponseReader(new ObjectMapper()), properties);
    }

    @Test
    void shouldParsePlanFromPlanningCapability() throws Exception {
        respondWith("{\"steps\": [{\"plugin\": \"text\", \"action\": \"receive\"},"
                + " {\"pluginId\": \"text\", \"action\": \"reply\"}], \"reason\": \"greet\"}");

        Pipeline pipeline = planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS);

        assertEquals(List.of(RECEIVE, REPLY), pipeline.remaining());
        assertEquals(CapabilityPipelinePlanner.MODE_PLAN, configs.get(0).get("mode"));
        assertTrue(prompts.get(0).contains("plugin: text, action: reply"));
        assertTrue(prompts.get(0).contains("hello"));
    }

    @Test
    void shouldKeepDuplicateStepsInReturnedOrder() throws Exception {
        respondWith("[{\"plugin\": \"text\", \"action\": \"reply\"}, {\"plugin\": \"text\", \"action\": \"reply\"}]");

        Pipeline pipeline = planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS);

        assertEquals(List.of(REPLY, REPLY), pipeline.remaining());
    }

    @Test
    void shouldAcceptEmptyPlan() throws Exception {
        respondWith("{\"steps\": []}");

        Pipeline pipeline = planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS);

        assertTrue(pipeline.isEmpty());
    }

    @Test
    void shouldFailPlanReferencingUnknownStep() {
        respondWith("{\"steps\": [{\"plugin\": \"text\", \"action\": \"teleport\"}]}");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS));

        assertInstanceOf(PlanningException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("text/teleport"));
    }

    @Test
    void shouldFailWhenPlanningCapabilityIsMissing() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS));

        PlanningException planningError = assertInstanceOf(PlanningException.class, ex.getCause());
        assertInstanceOf(UnknownCapabilityException.class, planningError.getCause());
    }

    @Test
    void shouldFailOnUnparseablePlan() {
        respondWith("I think you should reply.");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS));

        assertInstanceOf(PlanningException.class, ex.getCause());
    }

    @Test
    void shouldIncludeConversationHistoryInPlanPrompt() throws Exception {
        when(memoryPort.getRecentConversationHistory("alice", "web", 10)).thenReturn(List.of(
                ConversationInteraction.builder().userId("alice").platform("web").content("my name is Alice")
                        .timestamp(Instant.EPOCH).build()));
        respondWith("{\"steps\": []}");

        planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS);

        assertTrue(prompts.get(0).contains("## Conversation History:"));
        assertTrue(prompts.get(0).contains("my name is Alice"));
    }

    @Test
    void shouldIgnoreHistoryFailures() throws Exception {
        when(memoryPort.getRecentConversationHistory(anyString(), any(), anyInt()))
                .thenThrow(new IllegalStateException("memory down"));
        respondWith("{\"steps\": [{\"plugin\": \"text\", \"action\": \"reply\"}]}");

        Pipeline pipeline = planner.plan(chain(), registry.availableSteps()).get(1, TimeUnit.SECONDS);

        assertEquals(List.of(REPLY), pipeline.remaining());
        assertFalse(prompts.get(0).contains("## Conversation History:"));
    }

    @Test
    void shouldContinueWhenPlannerSaysContinue() throws Exception {
        respondWith("{\"decision\": \"continue\"}");

        ReplanDecision decision = planner.shouldReplan(chain(), List.of(REPLY)).get(1, TimeUnit.SECONDS);

        assertFalse(decision.isReplace());
        assertEquals(CapabilityPipelinePlanner.MODE_REPLAN, configs.get(0).get("mode"));
        assertTrue(prompts.get(0).contains("1. text/reply"));
    }

    @Test
    void shouldReturnReplaceDecision() throws Exception {
        respondWith("{\"decision\": \"replace\", \"steps\": [{\"plugin\": \"text\", \"action\": \"receive\"}],"
                + " \"reason\": \"need more input\"}");

        ReplanDecision decision = planner.shouldReplan(chain(), List.of(REPLY)).get(1, TimeUnit.SECONDS);

        assertTrue(decision.isReplace());
        assertEquals(List.of(RECEIVE), decision.steps());
        assertEquals("need more input", decision.reason());
    }

    @Test
    void shouldFailReplaceReferencingUnknownStep() {
        respondWith("{\"decision\": \"replace\", \"steps\": [{\"plugin\": \"ghost\", \"action\": \"boo\"}]}");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> planner.shouldReplan(chain(), List.of(REPLY)).get(1, TimeUnit.SECONDS));

        assertInstanceOf(PlanningException.class, ex.getCause());
    }

    @Test
    void shouldSkipCapabilityWhenReplanningDisabled() throws Exception {
        properties.getPlanner().setReplanEnabled(false);
        respondWith("{\"decision\": \"replace\", \"steps\": []}");

        ReplanDecision decision = planner.shouldReplan(chain(), List.of(REPLY)).get(1, TimeUnit.SECONDS);

        assertFalse(decision.isReplace());
        assertTrue(prompts.isEmpty());
        verify(memoryPort, never()).getRecentConversationHistory(anyString(), any(), any());
    }

    private void respondWith(String response) {
        router.registerCapability("planning", Set.of("planner"), (input, config) -> {
            prompts.add(input.toString());
            configs.add(config);
            return CompletableFuture.completedFuture(response);
        });
    }

    private ContextChain chain() {
        ContextChain chain = new ContextChain("e1");
        chain.append(ContextItem.builder()
                .id("e1")
                .pluginId("p-text")
                .action("receive")
                .type(ContextItemTypes.USER_INPUT)
                .content("hello")
                .createdAt(Instant.ofEpochMilli(1000))
                .payload(new UserInputPayload("alice", "web"))
                .build());
        return chain;
    }

    private static final class TextPlugin extends AbstractPlugin {

        TextPlugin() {
            super("text", "Text", "test plugin");
            addAction(ActionDescriptor.builder().name("receive").description("Receive input").build(),
                    context -> ActionResult.empty());
            addAction(ActionDescriptor.builder().name("reply").description("Reply to user")
                    .append(ContextItemTypes.RESPONSE).build(), context -> ActionResult.empty());
        }
    }
}
