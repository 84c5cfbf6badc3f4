package me.golemcore.orchestrator.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One immutable fact in a {@link ContextChain}.
 *
 * <p>
 * The {@code payload} carries the tag-specific extension fields. When present,
 * its {@link ContextPayload#itemType()} must equal {@code type}.
 */
@Builder
public record ContextItem(String id, String pluginId, String action, String type, String content,
        Instant createdAt, ContextPayload payload) {

    public ContextItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(createdAt, "createdAt");
        if (payload != null && !type.equals(payload.itemType())) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                    + " belongs to type '" + payload.itemType() + "', not '" + type + "'");
        }
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public boolean isError() {
        return ContextItemTypes.ERROR.equals(type);
    }

    public <T extends ContextPayload> Optional<T> payloadAs(Class<T> payloadType) {
        return payloadType.isInstance(payload) ? Optional.of(payloadType.cast(payload)) : Optional.empty();
    }
}
