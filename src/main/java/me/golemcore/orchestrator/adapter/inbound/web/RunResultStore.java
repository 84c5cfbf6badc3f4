package me.golemcore.orchestrator.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ResponseHandler;
import me.golemcore.orchestrator.domain.model.RunResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Response channel for events submitted over HTTP: remembers the most recent
 * run outcomes so clients can poll for them. The least recently recorded or
 * polled result is evicted first.
 */
@Component
@Slf4j
public class RunResultStore implements ResponseHandler {

    static final int MAX_RESULTS = 1000;

    private final Map<String, RunResult> results = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, RunResult> eldest) {
            return size() > MAX_RESULTS;
        }
    };

    @Override
    public void onRunComplete(RunResult result) {
        synchronized (results) {
            results.put(result.eventId(), result);
        }
        log.debug("[API] Recorded {} result for {}", result.status(), result.eventId());
    }

    public Optional<RunResult> find(String eventId) {
        synchronized (results) {
            return Optional.ofNullable(results.get(eventId));
        }
    }
}
