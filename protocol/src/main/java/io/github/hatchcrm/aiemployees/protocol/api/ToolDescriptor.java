package io.github.hatchcrm.aiemployees.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDescriptor(
        String key,
        String description,
        boolean allowAutoRun,
        boolean defaultRequiresApproval,
        JsonNode inputSchema
) {}
