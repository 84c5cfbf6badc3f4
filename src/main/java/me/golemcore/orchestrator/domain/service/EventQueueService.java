package me.golemcore.orchestrator.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.loop.PipelineExecutor;
import me.golemcore.orchestrator.domain.model.ErrorPayload;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.model.FailureKind;
import me.golemcore.orchestrator.domain.model.MonitorEventType;
import me.golemcore.orchestrator.domain.model.ResponseHandler;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.domain.model.RunStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Accepts events from any producer and dispatches them to the
 * {@link PipelineExecutor}, one run at a time per conversation key.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>Non-blocking submission: events are validated and queued, never
 * executed on the caller's thread.</li>
 * <li>FIFO per conversation key with at most one run in flight; different keys
 * run concurrently on the shared worker pool.</li>
 * <li>Holding events submitted before {@link #start()} until the runtime is
 * initialized.</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventQueueService {

    private final PipelineExecutor pipelineExecutor;
    private final ExecutorService eventRunExecutor;
    private final MonitorService monitorService;

    private final Map<String, ConversationRunner> runners = new ConcurrentHashMap<>();
    private final Object startLock = new Object();
    private final List<Event> held = new ArrayList<>();
    private volatile boolean started;

    /**
     * Validates and enqueues an event. Returns as soon as the event is queued.
     *
     * @throws me.golemcore.orchestrator.domain.exception.InvalidEventException
     *             if a required field is missing
     */
    public void submit(Event event) {
        EventValidator.validate(event);
        monitorService.emit(event, MonitorEventType.EVENT_SUBMITTED);
        log.debug("[Queue] Submitted {} for {}", event.getId(), event.getConversationKey());

        if (!started) {
            synchronized (startLock) {
                if (!started) {
                    held.add(event);
                    log.debug("[Queue] Runtime not started, holding {}", event.getId());
                    return;
                }
            }
        }
        dispatch(event);
    }

    /**
     * Opens the queue for dispatch and releases held events in submission order.
     */
    public void start() {
        synchronized (startLock) {
            if (started) {
                return;
            }
            if (!held.isEmpty()) {
                log.info("[Queue] Releasing {} event(s) held during startup", held.size());
            }
            for (Event event : held) {
                dispatch(event);
            }
            held.clear();
            // Published last so late submitters queue behind every held event
            started = true;
        }
        log.info("[Queue] Dispatch started");
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Number of conversation keys with a run in flight or queued events.
     */
    public int activeConversationCount() {
        return runners.size();
    }

    private void dispatch(Event event) {
        String key = event.getConversationKey();
        while (true) {
            ConversationRunner runner = runners.computeIfAbsent(key, ConversationRunner::new);
            if (runner.enqueue(event)) {
                return;
            }
        }
    }

    private final class ConversationRunner {

        private final String key;
        private final Object lock = new Object();
        private final Deque<Event> pending = new ArrayDeque<>();

        private boolean running;
        private boolean retired;

        private ConversationRunner(String key) {
            this.key = key;
        }

        /**
         * @return false if this runner was evicted and the caller must retry with a
         *         fresh one
         */
        boolean enqueue(Event event) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (running) {
                    pending.addLast(event);
                    log.debug("[Queue] {} busy, queued {} ({} pending)", key, event.getId(), pending.size());
                    return true;
                }
                running = true;
            }
            startRun(event);
            return true;
        }

        private void startRun(Event event) {
            try {
                eventRunExecutor.execute(() -> {
                    try {
                        RunResult result = pipelineExecutor.execute(event);
                        log.debug("[Queue] Run {} finished with {}", event.getId(), result.status());
                    } catch (Exception e) { // NOSONAR - must not kill executor thread
                        handleRunFailure(event, e);
                    } finally {
                        onRunComplete();
                    }
                });
            } catch (RejectedExecutionException e) {
                List<Event> dropped = new ArrayList<>();
                dropped.add(event);
                synchronized (lock) {
                    running = false;
                    dropped.addAll(pending);
                    pending.clear();
                }
                for (Event rejected : dropped) {
                    failRejected(rejected, e);
                }
                evictIfIdle();
            }
        }

        private void failRejected(Event event, RejectedExecutionException e) {
            log.warn("[Queue] Worker pool rejected {} for {}: {}", event.getId(), key, e.getMessage());
            ErrorPayload failure = ErrorPayload.forRun(FailureKind.STEP_FAILURE,
                    "Worker pool rejected the run: " + e.getMessage());
            monitorService.emit(event, MonitorEventType.RUN_FAILED, Map.of("failure", failure.kind().name()));

            ResponseHandler handler = event.getResponseHandler();
            if (handler == null) {
                return;
            }
            RunResult result = RunResult.builder()
                    .eventId(event.getId())
                    .conversationKey(key)
                    .status(RunStatus.FAILURE)
                    .chain(List.of())
                    .executedSteps(0)
                    .failure(failure)
                    .build();
            try {
                handler.onRunComplete(result);
            } catch (Exception handlerError) { // NOSONAR - the response channel belongs to the producer
                log.error("[Queue] Response handler for {} failed: {}", event.getId(), handlerError.getMessage(),
                        handlerError);
            }
        }

        private void handleRunFailure(Event event, Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("[Queue] Run interrupted: event={}, key={}", event.getId(), key);
                return;
            }
            log.error("[Queue] Run failed: event={}, key={}: {}", event.getId(), key, e.getMessage(), e);
        }

        private void onRunComplete() {
            Event next;
            synchronized (lock) {
                next = pending.pollFirst();
                if (next == null) {
                    running = false;
                }
            }
            if (next != null) {
                startRun(next);
                return;
            }
            evictIfIdle();
        }

        private void evictIfIdle() {
            synchronized (lock) {
                if (running || !pending.isEmpty() || retired) {
                    return;
                }
                retired = true;
            }
            if (runners.remove(key, this)) {
                log.debug("[Queue] Evicted idle runner: key={}", key);
            }
        }
    }
}
