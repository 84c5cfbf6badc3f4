package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.exception.InvalidEventException;
import me.golemcore.orchestrator.domain.loop.PipelineExecutor;
import me.golemcore.orchestrator.domain.model.ContextItemTypes;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.model.MonitorEventType;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.domain.model.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EventQueueServiceTest {

    private PipelineExecutor pipelineExecutor;
    private MonitorService monitorService;
    private ExecutorService executor;
    private EventQueueService queue;

    private final List<String> executed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        pipelineExecutor = mock(PipelineExecutor.class);
        monitorService = mock(MonitorService.class);
        executor = Executors.newFixedThreadPool(4);
        queue = new EventQueueService(pipelineExecutor, executor, monitorService);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunSameConversationOneAtATimeInSubmissionOrder() throws Exception {
        Gate gate = new Gate();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        doAnswer(inv -> {
            Event event = inv.getArgument(0);
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            if ("e1".equals(event.getId())) {
                gate.await();
            }
            executed.add(event.getId());
            inFlight.decrementAndGet();
            return success(event);
        }).when(pipelineExecutor).execute(any(Event.class));
        queue.start();

        queue.submit(event("e1", "alice"));
        gate.awaitStarted();
        queue.submit(event("e2", "alice"));
        queue.submit(event("e3", "alice"));

        assertTrue(executed.isEmpty());
        gate.release();
        drain();

        assertEquals(List.of("e1", "e2", "e3"), executed);
        assertEquals(1, maxInFlight.get());
    }

    @Test
    void shouldRunDifferentConversationsConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            bothStarted.countDown();
            release.await(2, TimeUnit.SECONDS);
            return success(inv.getArgument(0));
        }).when(pipelineExecutor).execute(any(Event.class));
        queue.start();

        queue.submit(event("e1", "alice"));
        queue.submit(event("e2", "bob"));

        assertTrue(bothStarted.await(2, TimeUnit.SECONDS));
        assertEquals(2, queue.activeConversationCount());
        release.countDown();
        drain();
    }

    @Test
    void shouldContinueWithNextEventWhenRunThrows() throws Exception {
        doAnswer(inv -> {
            Event event = inv.getArgument(0);
            executed.add(event.getId());
            if ("e1".equals(event.getId())) {
                throw new IllegalStateException("executor bug");
            }
            return success(event);
        }).when(pipelineExecutor).execute(any(Event.class));
        queue.start();

        queue.submit(event("e1", "alice"));
        queue.submit(event("e2", "alice"));
        drain();

        assertEquals(List.of("e1", "e2"), executed);
    }

    @Test
    void shouldHoldEventsUntilStarted() throws Exception {
        doAnswer(inv -> {
            Event event = inv.getArgument(0);
            executed.add(event.getId());
            return success(event);
        }).when(pipelineExecutor).execute(any(Event.class));

        queue.submit(event("e1", "alice"));
        queue.submit(event("e2", "alice"));

        assertFalse(queue.isStarted());
        verify(pipelineExecutor, never()).execute(any(Event.class));

        queue.start();
        queue.start();
        drain();

        assertEquals(List.of("e1", "e2"), executed);
    }

    @Test
    void shouldRejectInvalidEventWithoutQueueing() {
        queue.start();
        Event event = event("e1", "alice");
        event.setPluginId(null);

        assertThrows(InvalidEventException.class, () -> queue.submit(event));
        assertThrows(InvalidEventException.class, () -> queue.submit(null));

        verify(monitorService, never()).emit(any(Event.class), any(MonitorEventType.class));
        verify(pipelineExecutor, never()).execute(any(Event.class));
    }

    @Test
    void shouldEmitSubmittedMonitorEvent() {
        Event event = event("e1", "alice");

        queue.submit(event);

        verify(monitorService).emit(event, MonitorEventType.EVENT_SUBMITTED);
    }

    @Test
    void shouldEvictIdleConversationsAfterRuns() throws Exception {
        doAnswer(inv -> success(inv.getArgument(0))).when(pipelineExecutor).execute(any(Event.class));
        queue.start();

        queue.submit(event("e1", "alice"));
        queue.submit(event("e2", "bob"));
        queue.submit(event("e3", null));
        drain();

        assertEquals(0, queue.activeConversationCount());
    }

    @Test
    void shouldKeepSubmissionOrderForEventsSubmittedWhileHeldEventsAreReleased() throws Exception {
        Gate firstDispatch = new Gate();
        AtomicBoolean gated = new AtomicBoolean();
        executor.shutdownNow();
        executor = new ThreadPoolExecutor(4, 4, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>()) {
            @Override
            public void execute(Runnable command) {
                if (gated.compareAndSet(false, true)) {
                    try {
                        firstDispatch.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException(e);
                    }
                }
                super.execute(command);
            }
        };
        queue = new EventQueueService(pipelineExecutor, executor, monitorService);
        doAnswer(inv -> {
            Event event = inv.getArgument(0);
            executed.add(event.getId());
            return success(event);
        }).when(pipelineExecutor).execute(any(Event.class));

        queue.submit(event("b0", "bob"));
        queue.submit(event("a1", "alice"));
        Thread starter = new Thread(queue::start);
        starter.start();
        firstDispatch.awaitStarted();

        Thread submitter = new Thread(() -> queue.submit(event("a2", "alice")));
        submitter.start();
        awaitBlockedOrDone(submitter);
        firstDispatch.release();
        starter.join(2000);
        submitter.join(2000);
        drain();

        List<String> alice = executed.stream().filter(id -> id.startsWith("a")).toList();
        assertEquals(List.of("a1", "a2"), alice);
        assertTrue(executed.contains("b0"));
    }

    @Test
    void shouldFailQueuedEventsWhenWorkerPoolRejectsThem() throws Exception {
        Gate gate = new Gate();
        doAnswer(inv -> {
            Event event = inv.getArgument(0);
            if ("e1".equals(event.getId())) {
                gate.await();
            }
            executed.add(event.getId());
            return success(event);
        }).when(pipelineExecutor).execute(any(Event.class));
        List<RunResult> responses = new CopyOnWriteArrayList<>();
        queue.start();

        queue.submit(event("e1", "alice"));
        gate.awaitStarted();
        Event e2 = event("e2", "alice");
        e2.setResponseHandler(responses::add);
        Event e3 = event("e3", "alice");
        e3.setResponseHandler(responses::add);
        queue.submit(e2);
        queue.submit(e3);

        executor.shutdown();
        gate.release();
        assertTrue(executor.awaitTermination(2, TimeUnit.SECONDS));

        assertEquals(List.of("e1"), executed);
        assertEquals(List.of("e2", "e3"), responses.stream().map(RunResult::eventId).toList());
        assertTrue(responses.stream().allMatch(result -> result.status() == RunStatus.FAILURE));
        assertTrue(responses.stream().allMatch(result -> result.failure() != null));
        verify(monitorService).emit(eq(e2), eq(MonitorEventType.RUN_FAILED), anyMap());
        verify(monitorService).emit(eq(e3), eq(MonitorEventType.RUN_FAILED), anyMap());
        assertEquals(0, queue.activeConversationCount());
    }

    @Test
    void shouldNotThrowWhenWorkerPoolIsShutDown() {
        executor.shutdown();
        queue.start();
        List<RunResult> responses = new CopyOnWriteArrayList<>();
        Event event = event("e1", "alice");
        event.setResponseHandler(responses::add);

        assertDoesNotThrow(() -> queue.submit(event));
        assertEquals(0, queue.activeConversationCount());
        assertEquals(1, responses.size());
        assertEquals("e1", responses.get(0).eventId());
        assertEquals(RunStatus.FAILURE, responses.get(0).status());
    }

    private static void awaitBlockedOrDone(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (System.nanoTime() < deadline) {
            Thread.State state = thread.getState();
            if (state == Thread.State.BLOCKED || state == Thread.State.TERMINATED) {
                return;
            }
            Thread.sleep(5);
        }
    }

    private void drain() throws InterruptedException {
        // Chained runs are handed to the pool from worker threads, so shut down only once every runner is idle
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (queue.activeConversationCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(2, TimeUnit.SECONDS));
    }

    private static Event event(String id, String user) {
        return Event.builder()
                .id(id)
                .pluginId("chat")
                .action("receive")
                .type(ContextItemTypes.USER_INPUT)
                .content("hello " + id)
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .user(user)
                .platform("web")
                .build();
    }

    private static RunResult success(Event event) {
        return RunResult.builder()
                .eventId(event.getId())
                .conversationKey(event.getConversationKey())
                .status(RunStatus.SUCCESS)
                .chain(List.of())
                .build();
    }

    private static final class Gate {
        private final Object lock = new Object();
        private boolean released = false;
        private boolean started = false;

        void await() throws InterruptedException {
            synchronized (lock) {
                started = true;
                lock.notifyAll();
                while (!released) {
                    lock.wait();
                }
            }
        }

        void awaitStarted() throws InterruptedException {
            synchronized (lock) {
                while (!started) {
                    lock.wait();
                }
            }
        }

        void release() {
            synchronized (lock) {
                released = true;
                lock.notifyAll();
            }
        }
    }
}
