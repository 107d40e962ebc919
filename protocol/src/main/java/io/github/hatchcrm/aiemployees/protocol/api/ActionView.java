package io.github.hatchcrm.aiemployees.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Caller-facing projection of a proposed action, with the chat-ready summary of its result
 * when it has been executed.
 */
public record ActionView(
        String id,
        String employeeInstanceId,
        String sessionId,
        String actionType,
        JsonNode payload,
        ActionStatus status,
        boolean requiresApproval,
        boolean dryRun,
        String errorMessage,
        Instant executedAt,
        String approvedByUserId,
        String humanReadableResult,
        Instant createdAt
) {}
