package io.github.hatchcrm.aiemployees.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PersonaInstanceDto(
        String id,
        String tenantId,
        String templateKey,
        String displayName,
        AutonomyMode autonomyMode,
        PersonaStatus status,
        List<String> allowedTools,
        Map<String, Object> settings,
        Instant createdAt,
        Instant updatedAt
) {}
