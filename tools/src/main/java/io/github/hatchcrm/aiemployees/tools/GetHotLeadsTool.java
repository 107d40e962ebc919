package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.util.List;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class GetHotLeadsTool implements Tool {

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 50;

    private CrmDirectory crmDirectory;

    @Override public String key() { return "get_hot_leads"; }

    @Override public String description() {
        return "Fetch the hottest leads by score tier, lead score and recent activity.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("limit").put("type", "integer").put("minimum", 1).put("maximum", MAX_LIMIT);
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
        int limit = LeadJson.limit(input, DEFAULT_LIMIT, MAX_LIMIT);
        List<Lead> leads = crmDirectory.hotLeads(ctx.tenantId(), limit);

        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode array = result.putArray("leads");
        leads.stream().limit(limit).forEach(lead -> array.add(LeadJson.lead(lead)));
        result.put("requestedLimit", limit);
        result.put("availableCount", crmDirectory.countWorkableLeads(ctx.tenantId()));
        return ToolResult.success(result);
    }
}
