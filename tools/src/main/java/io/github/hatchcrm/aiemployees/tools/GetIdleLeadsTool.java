package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.time.Duration;
import java.time.Instant;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class GetIdleLeadsTool implements Tool {

    static final int DEFAULT_IDLE_DAYS = 3;

    private CrmDirectory crmDirectory;

    @Override public String key() { return "get_idle_leads"; }

    @Override public String description() {
        return "List idle leads with no recent activity.";
    }

    @Override public JsonNode inputSchema() {
        return idleLeadsSchema();
    }

    static ObjectNode idleLeadsSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("limit").put("type", "integer").put("minimum", 1).put("maximum", 50);
        props.putObject("idleDays").put("type", "integer").put("minimum", 1).put("maximum", 90)
                .put("description", "Days without activity before a lead counts as idle (default 3)");
        return schema;
    }

    static Instant idleSince(JsonNode input, Instant now) {
        int idleDays = input.path("idleDays").asInt(DEFAULT_IDLE_DAYS);
        return now.minus(Duration.ofDays(Math.max(1, idleDays)));
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
        int limit = LeadJson.limit(input, 10, 50);
        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode leads = result.putArray("leads");
        crmDirectory.idleLeads(ctx.tenantId(), idleSince(input, Instant.now()), limit)
                .forEach(lead -> leads.add(LeadJson.lead(lead)));
        return ToolResult.success(result);
    }
}
