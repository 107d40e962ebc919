package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.time.Instant;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class GetOverdueTasksTool implements Tool {

    private CrmDirectory crmDirectory;

    @Override public String key() { return "get_overdue_tasks"; }

    @Override public String description() { return "List overdue lead tasks."; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("limit").put("type", "integer").put("minimum", 1).put("maximum", 50);
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
        if (ctx.tenantId() == null || ctx.tenantId().isBlank()) {
            return ToolResult.failure("tenantId is required");
        }
        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode tasks = result.putArray("tasks");
        crmDirectory.overdueTasks(ctx.tenantId(), Instant.now(), LeadJson.limit(input, 15, 50))
                .forEach(task -> tasks.add(LeadJson.task(task)));
        return ToolResult.success(result);
    }
}
