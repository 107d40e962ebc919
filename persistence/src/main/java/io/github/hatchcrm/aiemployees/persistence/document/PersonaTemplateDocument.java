package io.github.hatchcrm.aiemployees.persistence.document;

import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Catalog entry for a persona; shared by every tenant. The key doubles as the document id.
 */
@Document(collection = "persona_templates")
public class PersonaTemplateDocument {

    @Id
    private String key;
    private String displayName;
    private String description;
    private String systemPrompt;
    private List<String> allowedTools;
    private AutonomyMode defaultAutonomyMode;
    private Map<String, Object> defaultSettings;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public PersonaTemplateDocument() {}

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getSystemPrompt() { return systemPrompt; }
    public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }

    public List<String> getAllowedTools() { return allowedTools; }
    public void setAllowedTools(List<String> allowedTools) { this.allowedTools = allowedTools; }

    public AutonomyMode getDefaultAutonomyMode() { return defaultAutonomyMode; }
    public void setDefaultAutonomyMode(AutonomyMode defaultAutonomyMode) { this.defaultAutonomyMode = defaultAutonomyMode; }

    public Map<String, Object> getDefaultSettings() { return defaultSettings; }
    public void setDefaultSettings(Map<String, Object> defaultSettings) { this.defaultSettings = defaultSettings; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
