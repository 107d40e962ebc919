package io.github.hatchcrm.aiemployees.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConversationRole {
    USER, ASSISTANT;

    @JsonValue
    public String wireValue() { return name().toLowerCase(); }

    /** Reserved execution-log key under which turns of this role are stored. */
    public String logKey() {
        return "conversation:" + wireValue();
    }

    /** Anything not ending in {@code assistant} is treated as a user turn. */
    public static ConversationRole fromLogKey(String toolKey) {
        return toolKey != null && toolKey.endsWith("assistant") ? ASSISTANT : USER;
    }
}
