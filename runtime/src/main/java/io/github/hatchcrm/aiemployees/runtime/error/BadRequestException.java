package io.github.hatchcrm.aiemployees.runtime.error;

/** Caller supplied something unusable (blank message, unknown persona, bad time window). */
public class BadRequestException extends AiEmployeeException {

    public BadRequestException(String message) {
        super(message);
    }
}
