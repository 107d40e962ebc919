package io.github.hatchcrm.aiemployees.runtime.error;

public class RateLimitExceededException extends AiEmployeeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
