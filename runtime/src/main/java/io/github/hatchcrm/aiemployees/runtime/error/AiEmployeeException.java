package io.github.hatchcrm.aiemployees.runtime.error;

/**
 * Base type for every failure the orchestration core raises on purpose.
 */
public class AiEmployeeException extends RuntimeException {

    public AiEmployeeException(String message) {
        super(message);
    }

    public AiEmployeeException(String message, Throwable cause) {
        super(message, cause);
    }
}
