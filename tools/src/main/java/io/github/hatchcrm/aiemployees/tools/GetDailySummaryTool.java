package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.time.Duration;
import java.time.Instant;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

public class GetDailySummaryTool implements Tool {

    private CrmDirectory crmDirectory;

    @Override public String key() { return "get_daily_summary"; }

    @Override public String description() {
        return "Summarize daily CRM metrics for the tenant: active, new and idle leads plus open and soon-due tasks.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("lookbackDays").put("type", "integer").put("minimum", 1).put("maximum", 30)
                .put("description", "How many days count as new (default 1)");
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
        int lookbackDays = input.path("lookbackDays").asInt(1);
        Instant now = Instant.now();
        DailySummary summary = crmDirectory.dailySummary(ctx.tenantId(), now.minus(Duration.ofDays(Math.max(1, lookbackDays))));

        ObjectNode result = MAPPER.createObjectNode();
        result.put("generatedAt", now.toString());
        ObjectNode totals = result.putObject("totals");
        totals.put("activeLeads", summary.activeLeads());
        totals.put("newLeads", summary.newLeads());
        totals.put("idleLeads", summary.idleLeads());
        ObjectNode tasks = result.putObject("tasks");
        tasks.put("open", summary.openTasks());
        tasks.put("dueSoon", summary.dueSoonTasks());
        return ToolResult.success(result);
    }
}
