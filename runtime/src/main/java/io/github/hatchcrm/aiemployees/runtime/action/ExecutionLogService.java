package io.github.hatchcrm.aiemployees.runtime.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hatchcrm.aiemployees.persistence.document.ExecutionLogDocument;
import io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.ExecutionLogRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes the audit row for each execution attempt and review decision.
 */
@Service
public class ExecutionLogService {

    public static final String REVIEW_PREFIX = "review:";
    public static final String REVIEW_APPROVED = REVIEW_PREFIX + "approved";
    public static final String REVIEW_REJECTED = REVIEW_PREFIX + "rejected";

    private final ExecutionLogRepository executionLogRepository;
    private final ObjectMapper objectMapper;

    public ExecutionLogService(ExecutionLogRepository executionLogRepository, ObjectMapper objectMapper) {
        this.executionLogRepository = executionLogRepository;
        this.objectMapper = objectMapper;
    }

    public ExecutionLogDocument recordSuccess(ProposedActionDocument action, String actorId, JsonNode output) {
        Object stored = output == null || output.isNull() ? null : objectMapper.convertValue(output, Object.class);
        return append(action, actorId, action.getActionType(), action.getPayload(), stored, true, null);
    }

    public ExecutionLogDocument recordFailure(ProposedActionDocument action, String actorId, String errorMessage) {
        return append(action, actorId, action.getActionType(), action.getPayload(), null, false, errorMessage);
    }

    public ExecutionLogDocument recordApproval(ProposedActionDocument action, String reviewerId, String note) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("decision", "approved");
        input.put("note", note);
        return append(action, reviewerId, REVIEW_APPROVED, input, null, true, null);
    }

    public ExecutionLogDocument recordRejection(ProposedActionDocument action, String reviewerId, String reason) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("decision", "rejected");
        input.put("note", reason);
        return append(action, reviewerId, REVIEW_REJECTED, input, null, false, reason);
    }

    /** Output of the most recent successful tool run of the action, as JSON. Review rows are skipped. */
    public Optional<JsonNode> latestSuccessOutput(ProposedActionDocument action) {
        return executionLogRepository
                .findFirstByProposedActionIdAndToolKeyAndSuccessTrueOrderByCreatedAtDesc(action.getId(), action.getActionType())
                .map(ExecutionLogDocument::getOutput)
                .map(output -> (JsonNode) objectMapper.valueToTree(output));
    }

    private ExecutionLogDocument append(ProposedActionDocument action, String actorId, String toolKey,
                                        Map<String, Object> input, Object output, boolean success, String error) {
        ExecutionLogDocument entry = new ExecutionLogDocument();
        entry.setId(UUID.randomUUID().toString());
        entry.setTenantId(action.getTenantId());
        entry.setEmployeeInstanceId(action.getEmployeeInstanceId());
        entry.setSessionId(action.getSessionId());
        entry.setUserId(actorId);
        entry.setProposedActionId(action.getId());
        entry.setToolKey(toolKey);
        entry.setInput(input);
        entry.setOutput(output);
        entry.setSuccess(success);
        entry.setErrorMessage(error);
        entry.setCreatedAt(Instant.now());
        return executionLogRepository.save(entry);
    }
}
