package me.golemcore.orchestrator.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only ordered record of everything produced while processing one
 * event. Owned by exactly one executor run; not thread-safe.
 */
public final class ContextChain {

    private final String eventId;
    private final List<ContextItem> items = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();

    public ContextChain(String eventId) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
    }

    public String getEventId() {
        return eventId;
    }

    /**
     * Appends an item. Identifiers are unique within the chain.
     */
    public void append(ContextItem item) {
        Objects.requireNonNull(item, "item");
        if (!ids.add(item.id())) {
            throw new IllegalArgumentException("Duplicate context item id in chain " + eventId + ": " + item.id());
        }
        items.add(item);
    }

    public void appendAll(List<ContextItem> newItems) {
        if (newItems == null) {
            return;
        }
        for (ContextItem item : newItems) {
            append(item);
        }
    }

    public List<ContextItem> items() {
        return Collections.unmodifiableList(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public ContextItem seed() {
        if (items.isEmpty()) {
            throw new IllegalStateException("Chain " + eventId + " has no seed item");
        }
        return items.get(0);
    }

    public Optional<ContextItem> last() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(items.size() - 1));
    }

    public Optional<ContextItem> lastOfType(String type) {
        for (int i = items.size() - 1; i >= 0; i--) {
            if (items.get(i).type().equals(type)) {
                return Optional.of(items.get(i));
            }
        }
        return Optional.empty();
    }

    public List<ContextItem> ofType(String type) {
        return items.stream().filter(item -> item.type().equals(type)).toList();
    }

    public boolean containsId(String id) {
        return ids.contains(id);
    }

    /**
     * Immutable copy handed to collaborators that outlive the run.
     */
    public List<ContextItem> snapshot() {
        return List.copyOf(items);
    }
}
