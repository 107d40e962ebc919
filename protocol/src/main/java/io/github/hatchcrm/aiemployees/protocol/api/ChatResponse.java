package io.github.hatchcrm.aiemployees.protocol.api;

import java.util.List;

public record ChatResponse(
        String sessionId,
        String employeeInstanceId,
        String reply,
        List<ActionView> actions
) {}
