package me.golemcore.orchestrator.domain.model;

/**
 * Typed extension fields of a {@link ContextItem}. Each variant belongs to
 * exactly one type tag.
 */
public interface ContextPayload {

    /**
     * Type tag this payload variant is valid for.
     */
    String itemType();
}
