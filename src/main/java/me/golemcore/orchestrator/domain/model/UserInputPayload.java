package me.golemcore.orchestrator.domain.model;

/**
 * Extension fields of a {@code user_input} item.
 */
public record UserInputPayload(String user, String platform) implements ContextPayload {

    @Override
    public String itemType() {
        return ContextItemTypes.USER_INPUT;
    }
}
