package io.github.hatchcrm.aiemployees.runtime.error;

/** The chat-completion call failed or timed out; the whole turn fails. */
public class ModelUnavailableException extends AiEmployeeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
