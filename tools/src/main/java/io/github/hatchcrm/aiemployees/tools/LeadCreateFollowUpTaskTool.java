package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class LeadCreateFollowUpTaskTool implements Tool {

    private CrmDirectory crmDirectory;

    @Override public String key() { return "lead_create_follow_up_task"; }

    @Override public String description() { return "Create a follow-up task for a lead."; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("leadId").put("type", "string").put("minLength", 1);
        props.putObject("title").put("type", "string").put("minLength", 3).put("maxLength", 140);
        props.putObject("dueAt").put("type", "string")
                .put("description", "ISO-8601 timestamp, e.g. 2026-03-01T15:00:00Z");
        props.putObject("assigneeId").put("type", "string");
        schema.putArray("required").add("leadId").add("title");
        return schema;
    }

    @Override public boolean allowAutoRun() { return false; }
    @Override public boolean defaultRequiresApproval() { return true; }

    public void setCrmDirectory(CrmDirectory crmDirectory) {
        this.crmDirectory = crmDirectory;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (crmDirectory == null) {
            return ToolResult.failure("CRM directory not available");
        }
        String leadId = LeadJson.text(input, "leadId");
        String title = LeadJson.text(input, "title");
        if (leadId == null) return ToolResult.failure("'leadId' is required");
        if (title == null) return ToolResult.failure("'title' is required");

        Instant dueAt = null;
        String dueAtText = LeadJson.text(input, "dueAt");
        if (dueAtText != null) {
            try {
                dueAt = Instant.parse(dueAtText);
            } catch (DateTimeParseException e) {
                return ToolResult.failure("Invalid dueAt format. Use ISO-8601 (e.g., 2026-03-01T15:00:00Z)");
            }
        }

        String taskId = crmDirectory.createTask(ctx.tenantId(), ctx.actorId(), leadId, title, dueAt,
                LeadJson.text(input, "assigneeId"));
        ObjectNode result = MAPPER.createObjectNode();
        result.put("taskId", taskId);
        result.put("title", title);
        return ToolResult.success(result);
    }
}
