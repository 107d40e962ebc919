package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.util.Optional;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class SendSmsTool implements Tool {

    private CrmDirectory crmDirectory;
    private MessagingGateway messagingGateway;

    @Override public String key() { return "send_sms"; }

    @Override public String description() { return "Send an SMS message to a lead."; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("leadId").put("type", "string").put("minLength", 1);
        props.putObject("from").put("type", "string").put("minLength", 3);
        props.putObject("to").put("type", "string").put("minLength", 3)
                .put("description", "Defaults to the lead's primary phone");
        props.putObject("body").put("type", "string").put("minLength", 2).put("maxLength", 1600);
        props.putObject("overrideQuietHours").put("type", "boolean");
        props.putObject("transactional").put("type", "boolean");
        schema.putArray("required").add("leadId").add("from").add("body");
        return schema;
    }

    @Override public boolean allowAutoRun() { return false; }
    @Override public boolean defaultRequiresApproval() { return true; }

    public void setCrmDirectory(CrmDirectory crmDirectory) {
        this.crmDirectory = crmDirectory;
    }

    public void setMessagingGateway(MessagingGateway messagingGateway) {
        this.messagingGateway = messagingGateway;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (messagingGateway == null) {
            return ToolResult.failure("Messaging gateway not available");
        }
        if (crmDirectory == null) {
            return ToolResult.failure("CRM directory not available");
        }
        if (ctx.tenantId() == null || ctx.tenantId().isBlank()) {
            return ToolResult.failure("tenantId is required");
        }
        String leadId = LeadJson.text(input, "leadId");
        String from = LeadJson.text(input, "from");
        String body = LeadJson.text(input, "body");
        if (leadId == null) return ToolResult.failure("'leadId' is required");
        if (from == null) return ToolResult.failure("'from' is required");
        if (body == null) return ToolResult.failure("'body' is required");

        Optional<Lead> lead = crmDirectory.findLead(ctx.tenantId(), leadId);
        if (lead.isEmpty()) {
            return ToolResult.failure("Lead " + leadId + " not found");
        }
        String to = LeadJson.text(input, "to");
        if (to == null) to = lead.get().primaryPhone();
        if (to == null || to.isBlank()) {
            return ToolResult.failure("Lead does not have a phone number and no 'to' value was provided");
        }

        String messageId = messagingGateway.sendSms(new SmsMessage(ctx.tenantId(), leadId, ctx.actorId(), from, to, body,
                input.path("overrideQuietHours").asBoolean(false), input.path("transactional").asBoolean(false)));
        ObjectNode result = MAPPER.createObjectNode();
        result.put("messageId", messageId);
        return ToolResult.success(result);
    }
}
