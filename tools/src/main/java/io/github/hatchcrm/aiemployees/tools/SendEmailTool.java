package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.util.Optional;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class SendEmailTool implements Tool {

    static final String PROMOTIONAL = "PROMOTIONAL";
    static final String TRANSACTIONAL = "TRANSACTIONAL";

    private CrmDirectory crmDirectory;
    private MessagingGateway messagingGateway;

    @Override public String key() { return "send_email"; }

    @Override public String description() { return "Send an email to a lead via the messaging service."; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("leadId").put("type", "string").put("minLength", 1);
        props.putObject("from").put("type", "string").put("format", "email");
        props.putObject("to").put("type", "string").put("format", "email")
                .put("description", "Defaults to the lead's primary email");
        props.putObject("subject").put("type", "string").put("minLength", 3);
        props.putObject("body").put("type", "string").put("minLength", 5);
        props.putObject("scope").put("type", "string").putArray("enum").add(PROMOTIONAL).add(TRANSACTIONAL);
        props.putObject("includeUnsubscribe").put("type", "boolean");
        schema.putArray("required").add("leadId").add("from").add("subject").add("body");
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
        String subject = LeadJson.text(input, "subject");
        String body = LeadJson.text(input, "body");
        if (leadId == null) return ToolResult.failure("'leadId' is required");
        if (from == null) return ToolResult.failure("'from' is required");
        if (subject == null) return ToolResult.failure("'subject' is required");
        if (body == null) return ToolResult.failure("'body' is required");

        Optional<Lead> lead = crmDirectory.findLead(ctx.tenantId(), leadId);
        if (lead.isEmpty()) {
            return ToolResult.failure("Lead " + leadId + " not found");
        }
        String to = LeadJson.text(input, "to");
        if (to == null) to = lead.get().primaryEmail();
        if (to == null || to.isBlank()) {
            return ToolResult.failure("Lead does not have an email address and no 'to' value was provided");
        }

        String scope = input.path("scope").asText(PROMOTIONAL);
        boolean includeUnsubscribe = input.has("includeUnsubscribe")
                ? input.path("includeUnsubscribe").asBoolean()
                : PROMOTIONAL.equals(scope);

        String messageId = messagingGateway.sendEmail(new EmailMessage(ctx.tenantId(), leadId, ctx.actorId(),
                from, to, cleanSubject(subject), body, includeUnsubscribe));
        ObjectNode result = MAPPER.createObjectNode();
        result.put("messageId", messageId);
        return ToolResult.success(result);
    }

    /** Collapses line breaks and runs of whitespace; mail headers are single-line. */
    static String cleanSubject(String subject) {
        return subject.replaceAll("\\s+", " ").trim();
    }
}
