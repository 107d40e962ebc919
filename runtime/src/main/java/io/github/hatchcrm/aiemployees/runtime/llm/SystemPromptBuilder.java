package io.github.hatchcrm.aiemployees.runtime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class SystemPromptBuilder {

    private final ObjectMapper objectMapper;

    public SystemPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String build(String personaPrompt, String instanceName, AutonomyMode mode,
                        List<String> allowedTools, Map<String, Object> settings) {
        List<String> lines = new ArrayList<>();
        lines.add(personaPrompt != null && !personaPrompt.isBlank()
                ? personaPrompt.trim()
                : "You are " + instanceName + ", an AI employee inside Hatch CRM.");
        lines.add("");
        lines.add("Instance name: " + instanceName);
        lines.add("Behavior mode: " + (mode != null ? mode.wireValue() : AutonomyMode.REQUIRES_APPROVAL.wireValue()));
        lines.add("Allowed tools: " + (allowedTools == null || allowedTools.isEmpty() ? "none" : String.join(", ", allowedTools)));
        lines.add("Respond with strict JSON only: {\"reply\": string, \"actions\": [{\"tool\": string, \"input\": object, \"requiresApproval\": boolean, \"summary\": string}]}.");
        lines.add("reply is concise (<= 4 sentences).");
        lines.add("Only use tools from the allowed list; use an empty actions array when no tool is needed.");
        lines.add("Settings: " + toJson(settings));
        lines.add("Never produce markdown or emojis.");
        return String.join("\n", lines);
    }

    private String toJson(Map<String, Object> settings) {
        try {
            return objectMapper.writeValueAsString(settings == null ? Map.of() : settings);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
