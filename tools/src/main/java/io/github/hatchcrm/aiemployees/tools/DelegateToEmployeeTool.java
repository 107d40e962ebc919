package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationCoordinator;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationRequest;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationResult;
import io.github.hatchcrm.aiemployees.runtime.session.ConversationHistoryService;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.time.Duration;
import java.util.List;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

/**
 * Asks one other persona for a reply. Without an explicit message the caller's latest user
 * message is forwarded; without a persona the message itself is scanned for a name.
 */
public class DelegateToEmployeeTool implements Tool {

    static final String[] PERSONA_FIELDS = {"persona", "personaKey", "employee"};
    static final String[] MESSAGE_FIELDS = {"message", "instruction", "task"};

    private DelegationCoordinator delegationCoordinator;
    private ConversationHistoryService conversationHistoryService;

    @Override public String key() { return "delegate_to_employee"; }

    @Override public String description() {
        return "Ask another AI employee (persona) for a response and return it.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("persona").put("type", "string")
                .put("description", "Persona key or display name, e.g. lead_nurse or Lumen");
        props.putObject("message").put("type", "string");
        return schema;
    }

    @Override public boolean allowAutoRun() { return true; }
    @Override public boolean defaultRequiresApproval() { return false; }
    @Override public Duration timeout() { return Duration.ofMinutes(3); }

    public void setDelegationCoordinator(DelegationCoordinator delegationCoordinator) {
        this.delegationCoordinator = delegationCoordinator;
    }

    public void setConversationHistoryService(ConversationHistoryService conversationHistoryService) {
        this.conversationHistoryService = conversationHistoryService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (delegationCoordinator == null) {
            return ToolResult.failure("Delegation coordinator not available");
        }
        String persona = LeadJson.firstText(input, PERSONA_FIELDS);
        String message = LeadJson.firstText(input, MESSAGE_FIELDS);
        if (message == null) {
            message = latestUserMessage(conversationHistoryService, ctx);
        }
        if (message == null || message.isBlank()) {
            return ToolResult.failure("Missing message for delegation");
        }

        DelegationResult result;
        if (persona == null) {
            List<DelegationRequest> extracted = delegationCoordinator.extractRequests(message);
            if (extracted.isEmpty()) {
                return ToolResult.failure("Missing persona for delegation");
            }
            result = delegationCoordinator.delegate(extracted.get(0).personaKey(), extracted.get(0).message(), ctx);
        } else {
            result = delegationCoordinator.delegate(persona, message, ctx);
        }
        return ToolResult.success(result == null ? MAPPER.nullNode() : MAPPER.valueToTree(result));
    }

    static String latestUserMessage(ConversationHistoryService history, ToolContext ctx) {
        if (history == null || ctx.sessionId() == null) return null;
        return history.latestUserMessage(ctx.sessionId(), ctx.employeeInstanceId()).orElse(null);
    }
}
