package io.github.hatchcrm.aiemployees.runtime.error;

import java.util.List;

/**
 * Tool input did not match the tool's JSON schema.
 */
public class ToolValidationException extends AiEmployeeException {

    private final String toolKey;
    private final List<String> errors;

    public ToolValidationException(String toolKey, List<String> errors) {
        super("Invalid input for tool '" + toolKey + "': " + String.join("; ", errors));
        this.toolKey = toolKey;
        this.errors = List.copyOf(errors);
    }

    public String getToolKey() { return toolKey; }
    public List<String> getErrors() { return errors; }
}
