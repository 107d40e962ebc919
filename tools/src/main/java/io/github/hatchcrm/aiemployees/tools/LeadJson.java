package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

final class LeadJson {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private LeadJson() {
    }

    static ObjectNode lead(Lead lead) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", lead.id());
        node.put("firstName", lead.firstName());
        node.put("lastName", lead.lastName());
        node.put("stage", lead.stage());
        node.put("scoreTier", lead.scoreTier());
        if (lead.leadScore() != null) {
            node.put("leadScore", lead.leadScore());
        } else {
            node.putNull("leadScore");
        }
        node.put("lastActivityAt", iso(lead.lastActivityAt()));
        node.put("createdAt", iso(lead.createdAt()));
        node.put("ownerId", lead.ownerId());
        return node;
    }

    static ObjectNode task(LeadTask task) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", task.id());
        node.put("title", task.title());
        node.put("dueAt", iso(task.dueAt()));
        node.put("personId", task.leadId());
        node.put("assigneeId", task.assigneeId());
        return node;
    }

    /** First non-blank string among {@code fields}, or null. */
    static String firstText(JsonNode input, String... fields) {
        if (input == null) return null;
        for (String field : fields) {
            JsonNode value = input.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    static String text(JsonNode input, String field) {
        String value = firstText(input, field);
        return value == null ? null : value.trim();
    }

    static int limit(JsonNode input, int fallback, int max) {
        JsonNode value = input == null ? null : input.get("limit");
        if (value == null || !value.canConvertToInt()) return fallback;
        return Math.max(1, Math.min(max, value.asInt()));
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
