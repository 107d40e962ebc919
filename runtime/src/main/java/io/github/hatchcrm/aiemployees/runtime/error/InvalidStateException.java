package io.github.hatchcrm.aiemployees.runtime.error;

/** Requested transition is not allowed from the action's current status. */
public class InvalidStateException extends AiEmployeeException {

    public InvalidStateException(String message) {
        super(message);
    }
}
