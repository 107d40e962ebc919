package io.github.hatchcrm.aiemployees.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One chat-completion call, kept for latency and cost tracking.
 */
@Document(collection = "ai_model_calls")
@CompoundIndex(name = "session_time", def = "{'sessionId': 1, 'timestamp': -1}")
public class ModelCallDocument {

    @Id
    private String id;
    private String tenantId;
    private String employeeInstanceId;
    private String sessionId;
    private String provider;
    private String model;
    private int messageCount;      // history entries + system prompt
    private int responseChars;
    private long durationMs;
    private boolean success;
    private String errorMessage;
    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant timestamp;

    public ModelCallDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getEmployeeInstanceId() { return employeeInstanceId; }
    public void setEmployeeInstanceId(String employeeInstanceId) { this.employeeInstanceId = employeeInstanceId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public int getMessageCount() { return messageCount; }
    public void setMessageCount(int messageCount) { this.messageCount = messageCount; }

    public int getResponseChars() { return responseChars; }
    public void setResponseChars(int responseChars) { this.responseChars = responseChars; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
