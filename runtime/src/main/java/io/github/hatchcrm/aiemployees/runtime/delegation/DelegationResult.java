package io.github.hatchcrm.aiemployees.runtime.delegation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DelegationResult(
        String personaKey,
        String personaName,
        String employeeInstanceId,
        String reply,
        List<String> toolReplies,
        Boolean error
) {
    public static final String UNKNOWN_INSTANCE = "unknown";

    public static DelegationResult failed(String personaKey, String personaName, String message) {
        return new DelegationResult(personaKey, personaName, UNKNOWN_INSTANCE, "Error: " + message, null, Boolean.TRUE);
    }
}
