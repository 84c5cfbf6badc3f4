package me.golemcore.orchestrator.domain.model;

/**
 * Extension fields of an {@code extraction} item.
 */
public record ExtractionPayload(String schemaName, int attempts) implements ContextPayload {

    @Override
    public String itemType() {
        return ContextItemTypes.EXTRACTION;
    }
}
