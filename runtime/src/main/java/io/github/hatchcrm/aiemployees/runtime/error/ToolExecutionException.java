package io.github.hatchcrm.aiemployees.runtime.error;

/**
 * A tool handler reported failure, threw, or ran past its timeout. The handler's own
 * exception, if any, is kept as the cause.
 */
public class ToolExecutionException extends AiEmployeeException {

    private final String toolKey;

    public ToolExecutionException(String toolKey, String message) {
        super(message);
        this.toolKey = toolKey;
    }

    public ToolExecutionException(String toolKey, String message, Throwable cause) {
        super(message, cause);
        this.toolKey = toolKey;
    }

    public String getToolKey() { return toolKey; }
}
