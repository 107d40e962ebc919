package io.github.hatchcrm.aiemployees.protocol.api;

import java.time.Instant;

public record ConversationEntry(
        ConversationRole role,
        String content,
        Instant createdAt
) {
    public ConversationEntry(ConversationRole role, String content) {
        this(role, content, null);
    }
}
