package io.github.hatchcrm.aiemployees.runtime.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An action that survived the allow-list check. Only {@link PlanParser} creates these, so
 * anything downstream can trust that {@link #tool()} was permitted for the persona.
 */
public final class ValidatedAction {

    private final String tool;
    private final ObjectNode input;
    private final Boolean requiresApproval;
    private final String summary;

    ValidatedAction(String tool, ObjectNode input, Boolean requiresApproval, String summary) {
        this.tool = tool;
        this.input = input;
        this.requiresApproval = requiresApproval;
        this.summary = summary;
    }

    public String tool() { return tool; }

    public ObjectNode input() { return input; }

    /** Explicit override from the model, or {@code null} to fall back to tool policy. */
    public Boolean requiresApproval() { return requiresApproval; }

    public String summary() { return summary; }

    @Override
    public String toString() {
        return "ValidatedAction{tool=" + tool + ", requiresApproval=" + requiresApproval + "}";
    }
}
