package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class LeadAddNoteTool implements Tool {

    private CrmDirectory crmDirectory;

    @Override public String key() { return "lead_add_note"; }

    @Override public String description() { return "Add a note to the specified lead record."; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("leadId").put("type", "string").put("minLength", 1);
        props.putObject("body").put("type", "string").put("minLength", 5).put("maxLength", 2000)
                .put("description", "Note text");
        schema.putArray("required").add("leadId").add("body");
        return schema;
    }

    @Override public boolean allowAutoRun() { return true; }
    @Override public boolean defaultRequiresApproval() { return false; }

    public void setCrmDirectory(CrmDirectory crmDirectory) {
        this.crmDirectory = crmDirectory;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (crmDirectory == null) {
            return ToolResult.failure("CRM directory not available");
        }
        String leadId = LeadJson.text(input, "leadId");
        String body = LeadJson.text(input, "body");
        if (leadId == null) return ToolResult.failure("'leadId' is required");
        if (body == null) return ToolResult.failure("'body' is required");

        String noteId = crmDirectory.addNote(ctx.tenantId(), ctx.actorId(), leadId, body);
        ObjectNode result = MAPPER.createObjectNode();
        result.put("noteId", noteId);
        return ToolResult.success(result);
    }
}
