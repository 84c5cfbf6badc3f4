package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.adapter.inbound.web.RunResultStore;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ContextItemDto;
import me.golemcore.orchestrator.adapter.inbound.web.dto.EventAcceptedResponse;
import me.golemcore.orchestrator.adapter.inbound.web.dto.EventSubmissionRequest;
import me.golemcore.orchestrator.adapter.inbound.web.dto.RunResultDto;
import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.Event;
import me.golemcore.orchestrator.domain.model.RunResult;
import me.golemcore.orchestrator.domain.service.EventQueueService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.UUID;

/**
 * HTTP producer: submits events to the queue and exposes recorded run results.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final EventQueueService eventQueueService;
    private final RunResultStore runResultStore;
    private final Clock clock;

    @PostMapping
    public Mono<ResponseEntity<EventAcceptedResponse>> submit(@RequestBody EventSubmissionRequest request) {
        return Mono.fromCallable(() -> {
            Event event = toEvent(request);
            eventQueueService.submit(event);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(EventAcceptedResponse.builder()
                            .eventId(event.getId())
                            .conversationKey(event.getConversationKey())
                            .build());
        });
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<RunResultDto>> getResult(@PathVariable String id) {
        return Mono.fromCallable(() -> runResultStore.find(id)
                .map(result -> ResponseEntity.ok(toDto(result)))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No finished run for event '" + id + "'")));
    }

    private Event toEvent(EventSubmissionRequest request) {
        return Event.builder()
                .id(request.getId() != null && !request.getId().isBlank()
                        ? request.getId()
                        : UUID.randomUUID().toString())
                .pluginId(request.getPluginId())
                .action(request.getAction())
                .type(request.getType())
                .content(request.getContent())
                .timestamp(request.getTimestamp() != null
                        ? Instant.ofEpochMilli(request.getTimestamp())
                        : clock.instant())
                .user(request.getUser())
                .platform(request.getPlatform())
                .metadata(request.getMetadata() != null ? new HashMap<>(request.getMetadata()) : new HashMap<>())
                .responseHandler(runResultStore)
                .build();
    }

    private RunResultDto toDto(RunResult result) {
        return RunResultDto.builder()
                .eventId(result.eventId())
                .conversationKey(result.conversationKey())
                .status(result.status().name())
                .executedSteps(result.executedSteps())
                .failureKind(result.failure() != null ? result.failure().kind().name() : null)
                .failureDetail(result.failure() != null ? result.failure().detail() : null)
                .chain(result.chain().stream().map(this::toItemDto).toList())
                .build();
    }

    private ContextItemDto toItemDto(ContextItem item) {
        return ContextItemDto.builder()
                .id(item.id())
                .pluginId(item.pluginId())
                .action(item.action())
                .type(item.type())
                .content(item.content())
                .createdAt(item.createdAt())
                .payload(item.payload())
                .build();
    }
}
