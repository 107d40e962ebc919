package io.github.hatchcrm.aiemployees.protocol.api;

public record SendMessageRequest(
        String message,
        String channel,
        String contextType,
        String contextId
) {
    public SendMessageRequest(String message) {
        this(message, null, null, null);
    }
}
