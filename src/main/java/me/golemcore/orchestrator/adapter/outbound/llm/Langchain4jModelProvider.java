package me.golemcore.orchestrator.adapter.outbound.llm;

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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.capability.CapabilityHandler;
import me.golemcore.orchestrator.capability.CapabilityRegistration;
import me.golemcore.orchestrator.domain.exception.CapabilityInvocationException;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ModelProviderPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Model provider backed by a langchain4j {@link ChatModel} (OpenAI-compatible
 * or Anthropic).
 *
 * <p>
 * Registers two text capabilities sharing one model: {@code chat} and
 * {@code planning}. Both take prompt text as input and return the model's text.
 * The optional {@code system_prompt} config entry is sent as a system message.
 * Without an API key the provider reports itself unavailable and registers
 * nothing.
 */
@Component
@Slf4j
public class Langchain4jModelProvider implements ModelProviderPort {

    public static final String CHAT_CAPABILITY = "chat";
    public static final String PLANNING_CAPABILITY = "planning";

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String CONFIG_SYSTEM_PROMPT = "system_prompt";

    private final OrchestratorProperties properties;
    private volatile ChatModel chatModel;
    private volatile boolean initialized;

    @Autowired
    public Langchain4jModelProvider(OrchestratorProperties properties) {
        this.properties = properties;
    }

    Langchain4jModelProvider(OrchestratorProperties properties, ChatModel chatModel) {
        this.properties = properties;
        this.chatModel = chatModel;
        this.initialized = true;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    @Override
    public List<CapabilityRegistration> capabilities() {
        if (!isAvailable()) {
            return List.of();
        }
        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        List<CapabilityRegistration> registrations = new ArrayList<>();
        registrations.add(new CapabilityRegistration(CHAT_CAPABILITY, aliases(llm.getChatAliases()),
                textHandler(CHAT_CAPABILITY)));
        registrations.add(new CapabilityRegistration(PLANNING_CAPABILITY, aliases(llm.getPlanningAliases()),
                textHandler(PLANNING_CAPABILITY)));
        return registrations;
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;
        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("[LLM] No API key configured for provider {}; model capabilities disabled", llm.getProvider());
            return;
        }
        chatModel = PROVIDER_ANTHROPIC.equalsIgnoreCase(llm.getProvider())
                ? createAnthropicModel(llm)
                : createOpenAiModel(llm);
        log.info("[LLM] Initialized {} model {}", llm.getProvider(), llm.getModel());
    }

    private ChatModel createAnthropicModel(OrchestratorProperties.LlmProperties llm) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(OrchestratorProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private CapabilityHandler textHandler(String capability) {
        return (input, config) -> CompletableFuture.supplyAsync(() -> complete(capability, input, config));
    }

    private String complete(String capability, Object input, Map<String, Object> config) {
        List<ChatMessage> messages = new ArrayList<>();
        Object systemPrompt = config != null ? config.get(CONFIG_SYSTEM_PROMPT) : null;
        if (systemPrompt instanceof String text && !text.isBlank()) {
            messages.add(SystemMessage.from(text));
        }
        messages.add(UserMessage.from(input != null ? input.toString() : ""));

        long startMs = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatModel.chat(messages);
        } catch (RuntimeException e) {
            log.error("[LLM] {} call failed: {}", capability, e.getMessage());
            throw new CapabilityInvocationException("LLM " + capability + " call failed: " + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null) {
            throw new CapabilityInvocationException("LLM " + capability + " returned no message");
        }
        log.debug("[LLM] {} completed in {}ms", capability, System.currentTimeMillis() - startMs);
        return response.aiMessage().text();
    }

    private static Set<String> aliases(List<String> configured) {
        Set<String> result = new LinkedHashSet<>();
        if (configured != null) {
            for (String alias : configured) {
                if (alias != null && !alias.isBlank()) {
                    result.add(alias.trim());
                }
            }
        }
        return result;
    }
}
