package io.github.hatchcrm.aiemployees.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit row. Tool invocations, conversation turns ({@code conversation:*})
 * and review decisions ({@code review:*}) all land here.
 */
@Document(collection = "ai_execution_logs")
@CompoundIndexes({
        @CompoundIndex(name = "tenant_time", def = "{'tenantId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "session_key_time", def = "{'sessionId': 1, 'toolKey': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "action_time", def = "{'proposedActionId': 1, 'createdAt': -1}")
})
public class ExecutionLogDocument {

    public static final String TENANT_ID = "tenantId";
    public static final String TOOL_KEY = "toolKey";
    public static final String CREATED_AT = "createdAt";

    @Id
    private String id;
    private String tenantId;
    private String employeeInstanceId;
    private String sessionId;
    private String userId;
    private String proposedActionId;
    private String toolKey;
    private Map<String, Object> input;
    private Object output;
    private boolean success;
    private String errorMessage;
    private Instant createdAt;

    public ExecutionLogDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getEmployeeInstanceId() { return employeeInstanceId; }
    public void setEmployeeInstanceId(String employeeInstanceId) { this.employeeInstanceId = employeeInstanceId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getProposedActionId() { return proposedActionId; }
    public void setProposedActionId(String proposedActionId) { this.proposedActionId = proposedActionId; }

    public String getToolKey() { return toolKey; }
    public void setToolKey(String toolKey) { this.toolKey = toolKey; }

    public Map<String, Object> getInput() { return input; }
    public void setInput(Map<String, Object> input) { this.input = input; }

    public Object getOutput() { return output; }
    public void setOutput(Object output) { this.output = output; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
