package io.github.hatchcrm.aiemployees.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PersonaStatus {
    ACTIVE, INACTIVE, DELETED;

    @JsonValue
    public String wireValue() { return name().toLowerCase(); }
}
