package io.github.hatchcrm.aiemployees.protocol.api;

import java.util.List;
import java.util.Map;

public record PersonaTemplateDto(
        String key,
        String displayName,
        String description,
        String systemPrompt,
        List<String> allowedTools,
        AutonomyMode defaultAutonomyMode,
        Map<String, Object> defaultSettings,
        boolean active
) {}
