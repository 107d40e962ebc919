package io.github.hatchcrm.aiemployees.protocol.api;

import java.util.List;
import java.util.Map;

/** Partial update; null fields are left untouched and {@code defaultSettings} is merged. */
public record UpdateTemplateRequest(
        String displayName,
        String description,
        String systemPrompt,
        List<String> allowedTools,
        Map<String, Object> defaultSettings
) {}
