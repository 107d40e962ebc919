package io.github.hatchcrm.aiemployees.persistence.document;

import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * An action a persona proposed in a plan. Only status transitions mutate it; it is never deleted.
 * {@code executionClaimedAt} is set by the single caller that wins the right to run the tool.
 */
@Document(collection = "ai_proposed_actions")
@CompoundIndexes({
        @CompoundIndex(name = "tenant_status", def = "{'tenantId': 1, 'status': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "session_time", def = "{'sessionId': 1, 'createdAt': 1}")
})
public class ProposedActionDocument {

    public static final String STATUS = "status";
    public static final String EXECUTION_CLAIMED_AT = "executionClaimedAt";

    @Id
    private String id;
    private String tenantId;
    private String employeeInstanceId;
    private String sessionId;
    private String userId;
    private String actionType;
    private Map<String, Object> payload;
    private ActionStatus status;
    private boolean requiresApproval;
    private boolean dryRun;
    private String errorMessage;
    private Instant executedAt;
    private String approvedByUserId;
    private Instant executionClaimedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public ProposedActionDocument() {}

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

    public String getActionType() { return actionType; }
    public void setActionType(String actionType) { this.actionType = actionType; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }

    public ActionStatus getStatus() { return status; }
    public void setStatus(ActionStatus status) { this.status = status; }

    public boolean isRequiresApproval() { return requiresApproval; }
    public void setRequiresApproval(boolean requiresApproval) { this.requiresApproval = requiresApproval; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }

    public String getApprovedByUserId() { return approvedByUserId; }
    public void setApprovedByUserId(String approvedByUserId) { this.approvedByUserId = approvedByUserId; }

    public Instant getExecutionClaimedAt() { return executionClaimedAt; }
    public void setExecutionClaimedAt(Instant executionClaimedAt) { this.executionClaimedAt = executionClaimedAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
