package me.golemcore.orchestrator.domain.model;

/**
 * Extension fields of a {@code response} item.
 */
public record ResponsePayload(String capability) implements ContextPayload {

    @Override
    public String itemType() {
        return ContextItemTypes.RESPONSE;
    }
}
