package me.golemcore.orchestrator.capability;

import me.golemcore.orchestrator.domain.exception.CapabilityConflictException;
import me.golemcore.orchestrator.domain.exception.CapabilityInvocationException;
import me.golemcore.orchestrator.domain.exception.CapabilityTimeoutException;
import me.golemcore.orchestrator.domain.exception.UnknownCapabilityException;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilityRouterTest {

    private CapabilityRouter router;

    @BeforeEach
    void setUp() {
        router = new CapabilityRouter(new OrchestratorProperties());
    }

    @Test
    void shouldResolveAllAliasesToSameHandler() {
        CapabilityHandler handler = (input, config) -> CompletableFuture.completedFuture("ok");
        router.registerCapability("chat", Set.of("llm", "text-generation"), handler);

        assertSame(handler, router.resolve("chat"));
        assertSame(router.resolve("llm"), router.resolve("text-generation"));
        assertEquals("chat", router.resolveId("llm"));
        assertEquals(Set.of("llm", "text-generation"), router.aliasesOf("chat"));
        assertEquals(List.of("chat"), router.listCapabilityIds());
    }

    @Test
    void shouldRejectAliasBoundToDifferentHandlerWithoutPartialRegistration() {
        router.registerCapability("chat", Set.of("llm"), (input, config) -> CompletableFuture.completedFuture("a"));

        CapabilityHandler other = (input, config) -> CompletableFuture.completedFuture("b");
        assertThrows(CapabilityConflictException.class,
                () -> router.registerCapability("completion", Set.of("llm"), other));

        assertFalse(router.isRegistered("completion"));
    }

    @Test
    void shouldRejectIdBoundToDifferentHandler() {
        router.registerCapability(CapabilityRegistration.of("chat",
                (input, config) -> CompletableFuture.completedFuture("a")));

        assertThrows(CapabilityConflictException.class, () -> router.registerCapability(
                CapabilityRegistration.of("chat", (input, config) -> CompletableFuture.completedFuture("b"))));
    }

    @Test
    void shouldAllowReRegisteringSameHandler() {
        CapabilityHandler handler = (input, config) -> CompletableFuture.completedFuture("ok");
        router.registerCapability("chat", Set.of("llm"), handler);
        router.registerCapability("chat", Set.of("llm"), handler);

        assertSame(handler, router.resolve("llm"));
    }

    @Test
    void shouldRejectSameHandlerUnderIdAlreadyAliasedByAnotherCapability() {
        CapabilityHandler handler = (input, config) -> CompletableFuture.completedFuture("ok");
        router.registerCapability("chat", Set.of("llm"), handler);

        assertThrows(CapabilityConflictException.class, () -> router.registerCapability("llm", Set.of(), handler));

        assertEquals(List.of("chat"), List.copyOf(router.listCapabilityIds()));
        assertEquals("chat", router.resolveId("llm"));
    }

    @Test
    void shouldFailResolveForUnknownCapability() {
        UnknownCapabilityException ex = assertThrows(UnknownCapabilityException.class,
                () -> router.resolve("missing"));

        assertEquals("missing", ex.getCapability());
    }

    @Test
    void shouldReturnFailedFutureForUnknownCapability() {
        CompletableFuture<Object> result = router.invoke("missing", "x", Map.of());

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(UnknownCapabilityException.class, ex.getCause());
    }

    @Test
    void shouldPassInputAndConfigToHandler() throws Exception {
        router.registerCapability("echo", Set.of(),
                (input, config) -> CompletableFuture.completedFuture(input + ":" + config.get("mode")));

        Object result = router.invoke("echo", "hi", Map.of("mode", "plan")).get(1, TimeUnit.SECONDS);

        assertEquals("hi:plan", result);
    }

    @Test
    void shouldNotRetryFailedHandler() {
        AtomicInteger calls = new AtomicInteger();
        router.registerCapability("flaky", Set.of(), (input, config) -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new RuntimeException("boom"));
        });

        CompletableFuture<Object> result = router.invoke("flaky", "x", Map.of());

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(CapabilityInvocationException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("boom"));
        assertEquals(1, calls.get());
    }

    @Test
    void shouldWrapSynchronousHandlerFailure() {
        router.registerCapability("broken", Set.of(), (input, config) -> {
            throw new IllegalStateException("not ready");
        });

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> router.invoke("broken", "x", Map.of()).get(1, TimeUnit.SECONDS));
        assertInstanceOf(CapabilityInvocationException.class, ex.getCause());
    }

    @Test
    void shouldFailWithTimeoutWhenHandlerNeverCompletes() {
        router.registerCapability("slow", Set.of(), (input, config) -> new CompletableFuture<>());

        CompletableFuture<Object> result = router.invoke("slow", "x", Map.of(), Duration.ofMillis(50));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(CapabilityTimeoutException.class, ex.getCause());
    }

    @Test
    void shouldRejectRegistrationAfterFreeze() {
        router.freeze();

        assertTrue(router.isFrozen());
        assertThrows(IllegalStateException.class, () -> router.registerCapability("late", Set.of(),
                (input, config) -> CompletableFuture.completedFuture("x")));
    }
}
