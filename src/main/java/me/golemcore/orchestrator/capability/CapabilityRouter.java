package me.golemcore.orchestrator.capability;

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
import me.golemcore.orchestrator.domain.exception.CapabilityConflictException;
import me.golemcore.orchestrator.domain.exception.CapabilityInvocationException;
import me.golemcore.orchestrator.domain.exception.CapabilityTimeoutException;
import me.golemcore.orchestrator.domain.exception.Failures;
import me.golemcore.orchestrator.domain.exception.OrchestratorException;
import me.golemcore.orchestrator.domain.exception.UnknownCapabilityException;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves capability identifiers and aliases to exactly one provider handler
 * and invokes it under a timeout.
 *
 * <p>
 * Registration happens during startup only; after {@link #freeze()} the table
 * is read concurrently without locking. {@link #invoke} never retries: retry
 * policy belongs to callers such as {@link StructuredExtractionService}.
 */
@Component
@Slf4j
public class CapabilityRouter {

    private final OrchestratorProperties properties;
    private final Map<String, Binding> bindingsByName = new ConcurrentHashMap<>();
    private final Map<String, Binding> bindingsById = new ConcurrentHashMap<>();

    private volatile boolean frozen;

    public CapabilityRouter(OrchestratorProperties properties) {
        this.properties = properties;
    }

    public void registerCapability(CapabilityRegistration registration) {
        registerCapability(registration.id(), registration.aliases(), registration.handler());
    }

    /**
     * Binds {@code id} and every alias to {@code handler}. Re-registering the same
     * handler is a no-op; binding any name to a different handler fails without
     * modifying the table.
     */
    public synchronized void registerCapability(String id, Set<String> aliases, CapabilityHandler handler) {
        if (frozen) {
            throw new IllegalStateException("Capability router is frozen; cannot register " + id);
        }
        requireName(id);
        if (handler == null) {
            throw new IllegalArgumentException("Capability handler must not be null: " + id);
        }

        Set<String> names = new LinkedHashSet<>();
        names.add(id);
        if (aliases != null) {
            for (String alias : aliases) {
                requireName(alias);
                names.add(alias);
            }
        }

        for (String name : names) {
            Binding existing = bindingsByName.get(name);
            if (existing != null && (existing.handler() != handler || !existing.id().equals(id))) {
                throw new CapabilityConflictException("Capability name '" + name
                        + "' already bound to capability '" + existing.id() + "'");
            }
        }

        Binding binding = bindingsById.computeIfAbsent(id, key -> new Binding(id, handler));
        for (String name : names) {
            bindingsByName.putIfAbsent(name, binding);
        }
        log.info("[Capabilities] Registered {} (aliases: {})", id, names.size() > 1 ? aliasesOf(id) : "none");
    }

    /**
     * Pure lookup of the handler behind an id or alias.
     */
    public CapabilityHandler resolve(String idOrAlias) {
        return binding(idOrAlias).handler();
    }

    /**
     * Canonical identifier behind an id or alias.
     */
    public String resolveId(String idOrAlias) {
        return binding(idOrAlias).id();
    }

    public boolean isRegistered(String idOrAlias) {
        return idOrAlias != null && bindingsByName.containsKey(idOrAlias);
    }

    public CompletableFuture<Object> invoke(String idOrAlias, Object input, Map<String, Object> config) {
        return invoke(idOrAlias, input, config,
                Duration.ofMillis(properties.getCapabilities().getDefaultTimeoutMs()));
    }

    /**
     * Resolves and calls the handler. The returned future fails with
     * {@link UnknownCapabilityException}, {@link CapabilityTimeoutException} or
     * {@link CapabilityInvocationException}.
     */
    public CompletableFuture<Object> invoke(String idOrAlias, Object input, Map<String, Object> config,
            Duration timeout) {
        Binding binding;
        try {
            binding = binding(idOrAlias);
        } catch (UnknownCapabilityException e) {
            return CompletableFuture.failedFuture(e);
        }

        Map<String, Object> safeConfig = config != null ? config : Map.of();
        CompletableFuture<Object> call;
        try {
            call = binding.handler().handle(input, safeConfig);
        } catch (RuntimeException e) { // NOSONAR - provider failures are surfaced to the caller
            return CompletableFuture.failedFuture(new CapabilityInvocationException(
                    "Capability '" + binding.id() + "' failed: " + Failures.describe(e), e));
        }
        if (call == null) {
            return CompletableFuture.failedFuture(new CapabilityInvocationException(
                    "Capability '" + binding.id() + "' returned no result"));
        }

        long timeoutMs = timeout != null ? timeout.toMillis() : properties.getCapabilities().getDefaultTimeoutMs();
        log.debug("[Capabilities] Invoking {} (requested as {}, timeout {}ms)", binding.id(), idOrAlias, timeoutMs);
        return call.thenApply(output -> output)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((output, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(output);
                    }
                    return CompletableFuture.<Object>failedFuture(translate(binding.id(), timeoutMs, error));
                })
                .thenCompose(future -> future);
    }

    public List<String> listCapabilityIds() {
        return List.copyOf(new TreeSet<>(bindingsById.keySet()));
    }

    public Set<String> aliasesOf(String id) {
        Binding binding = bindingsById.get(id);
        if (binding == null) {
            return Set.of();
        }
        List<String> aliases = new ArrayList<>();
        for (Map.Entry<String, Binding> entry : bindingsByName.entrySet()) {
            if (entry.getValue() == binding && !entry.getKey().equals(id)) {
                aliases.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSet(new TreeSet<>(aliases));
    }

    public void freeze() {
        frozen = true;
        log.info("[Capabilities] Frozen with {} capabilities, {} names", bindingsById.size(),
                bindingsByName.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    private Binding binding(String idOrAlias) {
        Binding binding = idOrAlias != null ? bindingsByName.get(idOrAlias) : null;
        if (binding == null) {
            throw new UnknownCapabilityException(idOrAlias);
        }
        return binding;
    }

    private Throwable translate(String id, long timeoutMs, Throwable error) {
        Throwable cause = Failures.unwrap(error);
        if (cause instanceof TimeoutException) {
            return new CapabilityTimeoutException("Capability '" + id + "' timed out after " + timeoutMs + "ms",
                    cause);
        }
        if (cause instanceof OrchestratorException) {
            return cause;
        }
        return new CapabilityInvocationException("Capability '" + id + "' failed: " + Failures.describe(cause),
                cause);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability id and aliases must not be blank");
        }
    }

    private record Binding(String id, CapabilityHandler handler) {
    }
}
