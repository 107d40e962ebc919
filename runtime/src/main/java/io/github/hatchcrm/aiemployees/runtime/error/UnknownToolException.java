package io.github.hatchcrm.aiemployees.runtime.error;

public class UnknownToolException extends AiEmployeeException {

    private final String toolKey;

    public UnknownToolException(String toolKey) {
        super("Unknown tool: " + toolKey);
        this.toolKey = toolKey;
    }

    public String getToolKey() { return toolKey; }
}
