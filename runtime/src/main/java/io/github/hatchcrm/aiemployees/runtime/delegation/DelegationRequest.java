package io.github.hatchcrm.aiemployees.runtime.delegation;

public record DelegationRequest(String personaKey, String message) {

    public DelegationRequest withMessage(String newMessage) {
        return new DelegationRequest(personaKey, newMessage);
    }
}
