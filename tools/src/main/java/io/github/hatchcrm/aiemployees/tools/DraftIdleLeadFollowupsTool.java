package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

/**
 * Drafts short SMS check-ins for the most neglected leads. Nothing is sent; the drafts are
 * meant to be reviewed and passed to {@code send_sms}.
 */
public class DraftIdleLeadFollowupsTool implements Tool {

    private CrmDirectory crmDirectory;

    @Override public String key() { return "draft_idle_lead_followups"; }

    @Override public String description() {
        return "Draft 1-2 sentence SMS follow-up texts for the top idle leads.";
    }

    @Override public JsonNode inputSchema() {
        return GetIdleLeadsTool.idleLeadsSchema();
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
        Instant now = Instant.now();
        int limit = LeadJson.limit(input, 3, 50);

        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode drafts = result.putArray("drafts");
        for (Lead lead : crmDirectory.idleLeads(ctx.tenantId(), GetIdleLeadsTool.idleSince(input, now), limit)) {
            ObjectNode draft = drafts.addObject();
            draft.put("leadId", lead.id());
            draft.put("name", lead.fullName());
            draft.put("text", draftText(lead, now));
        }
        return ToolResult.success(result);
    }

    static String draftText(Lead lead, Instant now) {
        String firstName = lead.firstName() == null ? "" : lead.firstName().trim();
        String opener = firstName.isEmpty() ? "Hi there," : "Hi " + firstName + ",";
        Instant lastTouch = lead.lastActivityAt() != null ? lead.lastActivityAt() : lead.createdAt();
        long daysIdle = lastTouch == null ? 0 : ChronoUnit.DAYS.between(
                lastTouch.atZone(ZoneOffset.UTC).toLocalDate(), now.atZone(ZoneOffset.UTC).toLocalDate());
        String idlePhrase = daysIdle > 0
                ? "it's been " + daysIdle + " days since we last connected"
                : "just checking in";
        return opener + " " + idlePhrase + ". Are you still looking, and would you like me to send "
                + "2-3 options that fit what you want?";
    }
}
