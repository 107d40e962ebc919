package io.github.hatchcrm.aiemployees.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One conversation scope. The unique index over the full key tuple is what makes the
 * lookup-or-create in the session service safe under concurrent first messages.
 */
@Document(collection = "ai_sessions")
@CompoundIndex(name = "session_scope",
        def = "{'personaInstanceId': 1, 'tenantId': 1, 'userId': 1, 'channel': 1, 'contextType': 1, 'contextId': 1}",
        unique = true)
public class SessionDocument {

    @Id
    private String id;
    private String personaInstanceId;
    private String tenantId;
    private String userId;
    private String channel;
    private String contextType;
    private String contextId;
    private Instant createdAt;
    private Instant lastInteractionAt;

    public SessionDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getPersonaInstanceId() { return personaInstanceId; }
    public void setPersonaInstanceId(String personaInstanceId) { this.personaInstanceId = personaInstanceId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }

    public String getContextType() { return contextType; }
    public void setContextType(String contextType) { this.contextType = contextType; }

    public String getContextId() { return contextId; }
    public void setContextId(String contextId) { this.contextId = contextId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastInteractionAt() { return lastInteractionAt; }
    public void setLastInteractionAt(Instant lastInteractionAt) { this.lastInteractionAt = lastInteractionAt; }
}
