package io.github.hatchcrm.aiemployees.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * A named side-effecting operation a persona may propose. Implementations are discovered
 * through {@link java.util.ServiceLoader} and receive their collaborators through public
 * single-argument setters.
 */
public interface Tool {

    String key();

    String description();

    /** JSON Schema (draft 7) the input must satisfy; {@code null} accepts anything. */
    JsonNode inputSchema();

    /** When false the tool never runs without a human approving it, whatever the persona mode. */
    boolean allowAutoRun();

    boolean defaultRequiresApproval();

    /** Per-tool execution bound; {@code null} falls back to {@code hatch.ai.tool-timeout}. */
    default Duration timeout() {
        return null;
    }

    ToolResult execute(ToolContext ctx, JsonNode input);
}
