package io.github.hatchcrm.aiemployees.protocol.api;

import java.time.Instant;
import java.util.Map;

public record UsageStatsDto(
        String personaKey,
        String personaName,
        long totalActions,
        long successfulActions,
        long failedActions,
        Map<String, Long> toolsUsed,
        Instant from,
        Instant to
) {}
