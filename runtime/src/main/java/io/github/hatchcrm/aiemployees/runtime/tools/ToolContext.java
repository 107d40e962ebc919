package io.github.hatchcrm.aiemployees.runtime.tools;

/**
 * Who is running a tool and on whose behalf. {@code delegationDepth} counts how many
 * persona-to-persona hops led to this call; a top-level turn is depth 0.
 */
public record ToolContext(
        String tenantId,
        String actorId,
        String sessionId,
        String employeeInstanceId,
        int delegationDepth
) {
    public ToolContext(String tenantId, String actorId, String sessionId, String employeeInstanceId) {
        this(tenantId, actorId, sessionId, employeeInstanceId, 0);
    }
}
