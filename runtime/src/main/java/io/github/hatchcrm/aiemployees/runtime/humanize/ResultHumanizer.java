package io.github.hatchcrm.aiemployees.runtime.humanize;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Renders tool results as one or two plain sentences for the chat transcript.
 * Tools missing from the table get no summary.
 */
@Component
public class ResultHumanizer {

    private static final int MAX_NAMES = 5;

    private final Map<String, Function<JsonNode, String>> formatters = Map.ofEntries(
            entry("get_daily_summary", ResultHumanizer::dailySummary),
            entry("get_hot_leads", ResultHumanizer::hotLeads),
            entry("get_idle_leads", ResultHumanizer::idleLeads),
            entry("draft_idle_lead_followups", ResultHumanizer::idleDrafts),
            entry("get_overdue_tasks", ResultHumanizer::overdueTasks),
            entry("lead_add_note", r -> "Note added to the lead."),
            entry("lead_create_follow_up_task", ResultHumanizer::followUpTask),
            entry("send_email", r -> "Email sent."),
            entry("send_sms", r -> "Text message sent."),
            entry("delegate_to_employee", ResultHumanizer::delegation),
            entry("coordinate_workflow", ResultHumanizer::workflow)
    );

    private static Map.Entry<String, Function<JsonNode, String>> entry(String toolKey,
                                                                     Function<JsonNode, String> formatter) {
        return Map.entry(toolKey, formatter);
    }

    public Optional<String> humanize(String toolKey, JsonNode result) {
        if (toolKey == null || result == null || result.isNull() || result.isMissingNode()) {
            return Optional.empty();
        }
        Function<JsonNode, String> formatter = formatters.get(toolKey);
        if (formatter == null) {
            return Optional.empty();
        }
        String text = formatter.apply(result);
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }

    public boolean supports(String toolKey) {
        return formatters.containsKey(toolKey);
    }

    private static String dailySummary(JsonNode r) {
        JsonNode totals = r.path("totals");
        JsonNode tasks = r.path("tasks");
        return "Daily summary: " + totals.path("activeLeads").asLong() + " active leads, "
                + totals.path("newLeads").asLong() + " new, "
                + totals.path("idleLeads").asLong() + " idle. "
                + tasks.path("open").asLong() + " open tasks, "
                + tasks.path("dueSoon").asLong() + " due soon.";
    }

    private static String hotLeads(JsonNode r) {
        JsonNode leads = r.path("leads");
        if (!leads.isArray() || leads.isEmpty()) {
            return "No hot leads right now.";
        }
        List<String> names = new ArrayList<>();
        for (JsonNode lead : leads) {
            String name = leadName(lead);
            if (lead.path("leadScore").isNumber()) {
                name += " (score " + Math.round(lead.path("leadScore").asDouble()) + ")";
            }
            names.add(name);
        }
        return "Top " + leads.size() + " hot leads: " + joinNames(names) + ".";
    }

    private static String idleLeads(JsonNode r) {
        JsonNode leads = r.path("leads");
        if (!leads.isArray() || leads.isEmpty()) {
            return "No idle leads.";
        }
        List<String> names = new ArrayList<>();
        leads.forEach(lead -> names.add(leadName(lead)));
        return leads.size() + " idle leads need attention: " + joinNames(names) + ".";
    }

    private static String idleDrafts(JsonNode r) {
        JsonNode drafts = r.path("drafts");
        if (!drafts.isArray() || drafts.isEmpty()) {
            return "No idle leads to follow up with.";
        }
        List<String> names = new ArrayList<>();
        drafts.forEach(d -> names.add(d.path("name").asText("Unknown lead")));
        return "Drafted " + drafts.size() + " follow-up texts for " + joinNames(names) + ".";
    }

    private static String overdueTasks(JsonNode r) {
        JsonNode tasks = r.path("tasks");
        if (!tasks.isArray() || tasks.isEmpty()) {
            return "No overdue tasks.";
        }
        List<String> titles = new ArrayList<>();
        tasks.forEach(t -> titles.add(t.path("title").asText("Untitled task")));
        return tasks.size() + " overdue tasks: " + joinNames(titles) + ".";
    }

    private static String followUpTask(JsonNode r) {
        String title = r.path("title").asText("");
        return title.isBlank() ? "Follow-up task created." : "Follow-up task created: " + title + ".";
    }

    private static String delegation(JsonNode r) {
        String name = r.path("personaName").asText("");
        String reply = r.path("reply").asText("").trim();
        if (reply.isEmpty()) return null;
        StringBuilder sb = new StringBuilder(name.isBlank() ? reply : name + ": " + reply);
        JsonNode toolReplies = r.path("toolReplies");
        if (toolReplies.isArray()) {
            toolReplies.forEach(t -> {
                if (!t.asText("").isBlank()) sb.append(' ').append(t.asText().trim());
            });
        }
        return sb.toString();
    }

    private static String workflow(JsonNode r) {
        JsonNode results = r.path("results");
        if (!results.isArray() || results.isEmpty()) {
            return "No personas responded.";
        }
        List<String> lines = new ArrayList<>();
        for (JsonNode branch : results) {
            String line = delegation(branch);
            if (line != null) lines.add(line);
        }
        return String.join("\n", lines);
    }

    private static String leadName(JsonNode lead) {
        String first = lead.path("firstName").asText("").trim();
        String last = lead.path("lastName").asText("").trim();
        String name = (first + " " + last).trim();
        if (name.isEmpty()) name = lead.path("name").asText("").trim();
        return name.isEmpty() ? "Unknown lead" : name;
    }

    private static String joinNames(List<String> names) {
        if (names.size() <= MAX_NAMES) {
            return String.join(", ", names);
        }
        return String.join(", ", names.subList(0, MAX_NAMES)) + " and " + (names.size() - MAX_NAMES) + " more";
    }
}
