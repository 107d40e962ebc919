package io.github.hatchcrm.aiemployees.runtime.conversation;

/**
 * One inbound message. {@code delegationDepth} is 0 for a human caller and grows by one per
 * nested delegation.
 */
public record ChatTurnRequest(
        String tenantId,
        String personaInstanceId,
        String userId,
        String channel,
        String contextType,
        String contextId,
        String message,
        int delegationDepth
) {
    public ChatTurnRequest(String tenantId, String personaInstanceId, String userId, String channel,
                           String contextType, String contextId, String message) {
        this(tenantId, personaInstanceId, userId, channel, contextType, contextId, message, 0);
    }
}
