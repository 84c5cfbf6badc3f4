package me.golemcore.orchestrator.plugin.builtin.conversation;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.capability.CapabilityRouter;
import me.golemcore.orchestrator.domain.exception.StepExecutionException;
import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.ContextItemTypes;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.model.ResponsePayload;
import me.golemcore.orchestrator.domain.model.UserInputPayload;
import me.golemcore.orchestrator.plugin.api.ActionContext;
import me.golemcore.orchestrator.plugin.api.ActionDescriptor;
import me.golemcore.orchestrator.plugin.api.ActionResult;
import me.golemcore.orchestrator.plugin.api.PluginContext;
import me.golemcore.orchestrator.plugin.builtin.AbstractPlugin;
import me.golemcore.orchestrator.port.outbound.MemoryPort;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in plugin that answers the user through the chat capability and keeps
 * conversation memory.
 */
@Slf4j
public final class ConversationPlugin extends AbstractPlugin {

    public static final String PLUGIN_ID = "conversation";
    public static final String ACTION_RESPOND = "respond";
    public static final String ACTION_REMEMBER = "remember";

    static final String CHAT_CAPABILITY = "chat";
    static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant. Answer the user's latest message "
            + "using the conversation context provided.";

    private CapabilityRouter capabilityRouter;
    private MemoryPort memoryPort;
    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    public ConversationPlugin() {
        super(PLUGIN_ID, "Conversation", "Generates replies with the chat capability and stores user input.",
                CHAT_CAPABILITY);
        addAction(ActionDescriptor.builder()
                .name(ACTION_RESPOND)
                .description("Generate a reply to the user from the context so far")
                .read(ContextItemTypes.USER_INPUT)
                .read(ContextItemTypes.EXTRACTION)
                .append(ContextItemTypes.RESPONSE)
                .exclusiveEffect("reply")
                .build(), this::respond);
        addAction(ActionDescriptor.builder()
                .name(ACTION_REMEMBER)
                .description("Store the user's message in conversation memory")
                .read(ContextItemTypes.USER_INPUT)
                .build(), this::remember);
    }

    @Override
    public void init(PluginContext context) {
        capabilityRouter = context.requireService(CapabilityRouter.class);
        memoryPort = context.requireService(MemoryPort.class);
        Object configured = context.pluginConfig(PLUGIN_ID).get("system-prompt");
        if (configured instanceof String prompt && !prompt.isBlank()) {
            systemPrompt = prompt;
        }
    }

    ActionResult respond(ActionContext context) throws Exception {
        requireInitialized();
        String transcript = renderTranscript(context);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("system_prompt", systemPrompt);
        Object output = capabilityRouter.invoke(CHAT_CAPABILITY, transcript, config).get();
        if (output == null || output.toString().isBlank()) {
            return ActionResult.failure("Chat capability returned an empty reply");
        }

        String capabilityId = capabilityRouter.resolveId(CHAT_CAPABILITY);
        return ActionResult.success(context.newItem(ContextItemTypes.RESPONSE, output.toString().trim(),
                new ResponsePayload(capabilityId)));
    }

    ActionResult remember(ActionContext context) {
        requireInitialized();
        ContextItem input = context.latest(ContextItemTypes.USER_INPUT).orElse(null);
        if (input == null) {
            log.debug("[Plugins] conversation/remember: no user input in chain, nothing to store");
            return ActionResult.empty();
        }
        Event event = context.getEvent();
        UserInputPayload payload = input.payloadAs(UserInputPayload.class)
                .orElse(new UserInputPayload(event.getUser(), event.getPlatform()));
        if (payload.user() == null || payload.user().isBlank()) {
            log.debug("[Plugins] conversation/remember: anonymous input, nothing to store");
            return ActionResult.empty();
        }
        memoryPort.storeUserInteraction(payload.user(), payload.platform(), input.content(), input.createdAt(),
                input.id());
        return ActionResult.empty();
    }

    private String renderTranscript(ActionContext context) {
        StringBuilder sb = new StringBuilder();
        for (ContextItem item : context.getItems()) {
            if (item.content() == null || item.content().isBlank()) {
                continue;
            }
            sb.append('[').append(item.type()).append("] ").append(item.content()).append('\n');
        }
        return sb.toString();
    }

    private void requireInitialized() {
        if (capabilityRouter == null || memoryPort == null) {
            throw new StepExecutionException("Plugin " + PLUGIN_ID + " is not initialized");
        }
    }
}
