package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationRequest;
import io.github.hatchcrm.aiemployees.runtime.delegation.WorkflowPrefetchHook;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

/**
 * When a workflow asks who to call by lead score, fetches the top leads once and hands the
 * list to Echo and Lumen so both branches work from the same names.
 */
@Component
public class HotLeadPrefetchHook implements WorkflowPrefetchHook {

    private static final Logger log = LoggerFactory.getLogger(HotLeadPrefetchHook.class);

    static final String COPILOT_KEY = "agent_copilot";
    static final String NURSE_KEY = "lead_nurse";
    static final int DEFAULT_TOP_N = 3;

    private static final Pattern LEAD_SCORE_REQUEST = Pattern.compile(
            "\\b(lead\\s*score|leadscore|score\\s*tier|call\\s+targets|who\\s+should\\s+i\\s+call|prioritiz(e|ing)|top\\s+\\d+)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TOP_N = Pattern.compile("\\btop\\s+(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private final ToolRegistry toolRegistry;

    public HotLeadPrefetchHook(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @Override
    public List<DelegationRequest> beforeFanOut(String message, List<DelegationRequest> requests, ToolContext context) {
        String text = message == null ? "" : message;
        boolean targetsLeadPersona = requests.stream()
                .anyMatch(r -> COPILOT_KEY.equals(r.personaKey()) || NURSE_KEY.equals(r.personaKey()));
        if (!targetsLeadPersona || !LEAD_SCORE_REQUEST.matcher(text).find()) {
            return requests;
        }

        int topN = topN(text);
        List<JsonNode> leads;
        try {
            ObjectNode input = MAPPER.createObjectNode().put("limit", Math.max(5, topN));
            JsonNode output = toolRegistry.execute("get_hot_leads", input, context);
            leads = new ArrayList<>();
            JsonNode array = output == null ? null : output.path("leads");
            if (array != null && array.isArray()) {
                for (JsonNode lead : array) {
                    if (lead.isObject() && leads.size() < topN) leads.add(lead);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Hot lead prefetch failed, continuing without lead context: {}", e.getMessage());
            return requests;
        }
        if (leads.isEmpty()) {
            return requests;
        }

        String leadContext = formatLeads(leads);
        log.debug("Attaching {} hot leads to workflow branches", leads.size());
        List<DelegationRequest> rewritten = new ArrayList<>(requests.size());
        for (DelegationRequest request : requests) {
            if (COPILOT_KEY.equals(request.personaKey())) {
                rewritten.add(request.withMessage(request.message() + "\n\n" + leadContext
                        + "\n\nReturn the top " + topN + " call targets (name + leadId) and 1 reason each."));
            } else if (NURSE_KEY.equals(request.personaKey())) {
                rewritten.add(request.withMessage(request.message()
                        + "\n\nWrite 1-2 sentence outreach texts for each lead below. Label each text with the lead's name.\n"
                        + leadContext));
            } else {
                rewritten.add(request);
            }
        }
        return rewritten;
    }

    static int topN(String message) {
        Matcher matcher = TOP_N.matcher(message);
        if (matcher.find()) {
            try {
                int n = Integer.parseInt(matcher.group(1));
                if (n > 0) return Math.min(10, n);
            } catch (NumberFormatException e) {
                log.debug("Ignoring oversized top-N value {}", matcher.group(1));
            }
        }
        return DEFAULT_TOP_N;
    }

    static String formatLeads(List<JsonNode> leads) {
        StringBuilder sb = new StringBuilder("Here are the current highest-scoring leads from the CRM:");
        for (JsonNode lead : leads) {
            String first = lead.path("firstName").asText("").trim();
            String last = lead.path("lastName").asText("").trim();
            String name = (first + " " + last).trim();
            if (name.isEmpty()) name = "Unknown lead";

            List<String> bits = new ArrayList<>();
            if (lead.path("id").isTextual()) bits.add("leadId: " + lead.path("id").asText());
            if (lead.path("scoreTier").isTextual()) bits.add("tier: " + lead.path("scoreTier").asText());
            if (lead.path("leadScore").isNumber()) bits.add("score: " + Math.round(lead.path("leadScore").asDouble()));
            if (lead.path("stage").isTextual()) {
                bits.add("stage: " + lead.path("stage").asText().replaceAll("[_-]+", " ").toLowerCase());
            }
            sb.append("\n- ").append(name);
            if (!bits.isEmpty()) sb.append(" (").append(String.join(", ", bits)).append(')');
        }
        return sb.toString();
    }
}
