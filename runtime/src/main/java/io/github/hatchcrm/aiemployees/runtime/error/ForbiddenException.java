package io.github.hatchcrm.aiemployees.runtime.error;

/** Caller lacks the role, or the persona instance is not active. */
public class ForbiddenException extends AiEmployeeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
