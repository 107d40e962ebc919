package io.github.hatchcrm.aiemployees.runtime.action;

import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;

/**
 * Everything intake needs to know about the turn that produced a plan.
 */
public record ActionScope(
        String tenantId,
        String employeeInstanceId,
        String sessionId,
        String userId,
        AutonomyMode autonomyMode,
        boolean dryRun,
        int delegationDepth
) {}
