package io.github.hatchcrm.aiemployees.runtime.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument;
import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import io.github.hatchcrm.aiemployees.protocol.api.ActionView;
import io.github.hatchcrm.aiemployees.runtime.humanize.ResultHumanizer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds {@link ActionView}s. The readable result comes from the latest successful execution
 * log row, never from the stored payload.
 */
@Component
public class ActionViewMapper {

    private final ExecutionLogService executionLogService;
    private final ResultHumanizer humanizer;
    private final ObjectMapper objectMapper;

    public ActionViewMapper(ExecutionLogService executionLogService, ResultHumanizer humanizer, ObjectMapper objectMapper) {
        this.executionLogService = executionLogService;
        this.humanizer = humanizer;
        this.objectMapper = objectMapper;
    }

    public ActionView toView(ProposedActionDocument doc) {
        return new ActionView(
                doc.getId(),
                doc.getEmployeeInstanceId(),
                doc.getSessionId(),
                doc.getActionType(),
                doc.getPayload() == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(doc.getPayload()),
                doc.getStatus(),
                doc.isRequiresApproval(),
                doc.isDryRun(),
                doc.getErrorMessage(),
                doc.getExecutedAt(),
                doc.getApprovedByUserId(),
                humanReadableResult(doc),
                doc.getCreatedAt());
    }

    public List<ActionView> toViews(List<ProposedActionDocument> docs) {
        return docs.stream().map(this::toView).toList();
    }

    private String humanReadableResult(ProposedActionDocument doc) {
        if (doc.getStatus() != ActionStatus.EXECUTED) {
            return null;
        }
        JsonNode output = executionLogService.latestSuccessOutput(doc).orElse(null);
        if (output == null) {
            return null;
        }
        if (doc.isDryRun()) {
            return output.path("message").asText(null);
        }
        return humanizer.humanize(doc.getActionType(), output).orElse(null);
    }
}
