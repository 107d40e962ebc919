package io.github.hatchcrm.aiemployees.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-persona policy controlling how far a proposed action may travel without a human.
 */
public enum AutonomyMode {
    SUGGEST_ONLY("suggest-only"),
    REQUIRES_APPROVAL("requires-approval"),
    AUTO_RUN("auto-run");

    private final String wireValue;

    AutonomyMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() { return wireValue; }

    /** True when every action must be reviewed before it can run. */
    public boolean forcesApproval() {
        return this != AUTO_RUN;
    }

    @JsonCreator
    public static AutonomyMode fromWire(String value) {
        if (value == null) return null;
        for (AutonomyMode mode : values()) {
            if (mode.wireValue.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown autonomy mode: " + value);
    }
}
