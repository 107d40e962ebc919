package io.github.hatchcrm.aiemployees.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionStatus {
    PROPOSED("proposed"),
    REQUIRES_APPROVAL("requires-approval"),
    APPROVED("approved"),
    EXECUTED("executed"),
    FAILED("failed"),
    REJECTED("rejected");

    private final String wireValue;

    ActionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() { return wireValue; }

    public boolean isTerminal() {
        return this == EXECUTED || this == FAILED || this == REJECTED;
    }

    public boolean isPending() {
        return this == PROPOSED || this == REQUIRES_APPROVAL;
    }

    @JsonCreator
    public static ActionStatus fromWire(String value) {
        if (value == null) return null;
        for (ActionStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown action status: " + value);
    }
}
