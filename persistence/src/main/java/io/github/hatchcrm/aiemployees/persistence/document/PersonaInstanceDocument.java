package io.github.hatchcrm.aiemployees.persistence.document;

import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "persona_instances")
@CompoundIndex(name = "tenant_template", def = "{'tenantId': 1, 'templateKey': 1}", unique = true)
public class PersonaInstanceDocument {

    @Id
    private String id;
    private String tenantId;
    private String templateKey;
    private String nameOverride;
    private AutonomyMode autonomyMode;
    private PersonaStatus status;
    private Map<String, Object> settings;
    private Instant createdAt;
    private Instant updatedAt;

    public PersonaInstanceDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getTemplateKey() { return templateKey; }
    public void setTemplateKey(String templateKey) { this.templateKey = templateKey; }

    public String getNameOverride() { return nameOverride; }
    public void setNameOverride(String nameOverride) { this.nameOverride = nameOverride; }

    public AutonomyMode getAutonomyMode() { return autonomyMode; }
    public void setAutonomyMode(AutonomyMode autonomyMode) { this.autonomyMode = autonomyMode; }

    public PersonaStatus getStatus() { return status; }
    public void setStatus(PersonaStatus status) { this.status = status; }

    public Map<String, Object> getSettings() { return settings; }
    public void setSettings(Map<String, Object> settings) { this.settings = settings; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
