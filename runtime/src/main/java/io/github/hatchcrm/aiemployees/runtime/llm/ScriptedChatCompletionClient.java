package io.github.hatchcrm.aiemployees.runtime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationEntry;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic keyword-driven planner for running without an API key.
 * Produces the same JSON plan shape a real model is asked for.
 *
 * Activate with: HATCH_AI_LLM_PROVIDER=scripted
 */
@Service
@ConditionalOnProperty(name = "hatch.ai.llm.provider", havingValue = "scripted")
public class ScriptedChatCompletionClient implements ChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(ScriptedChatCompletionClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String complete(String systemPrompt, List<ConversationEntry> history, CompletionFormat format) {
        String lastUserMessage = lastUserMessage(history);
        String response = plan(lastUserMessage).toString();
        log.debug("[SCRIPTED LLM] message length={}, response={}", lastUserMessage.length(), response);
        return response;
    }

    ObjectNode plan(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode actions = root.putArray("actions");

        if (lower.contains("summary") || lower.contains("today")) {
            addAction(actions, "get_daily_summary", MAPPER.createObjectNode(), "Pull today's summary");
        }
        if (lower.contains("hot lead") || lower.contains("priorit")) {
            ObjectNode input = MAPPER.createObjectNode();
            input.put("limit", 5);
            addAction(actions, "get_hot_leads", input, "List the hottest leads");
        }
        if (lower.contains("idle") || lower.contains("stale")) {
            addAction(actions, "get_idle_leads", MAPPER.createObjectNode(), "Find idle leads");
        }
        if (lower.contains("overdue")) {
            addAction(actions, "get_overdue_tasks", MAPPER.createObjectNode(), "List overdue tasks");
        }
        if (lower.contains("workflow") || lower.contains("team")) {
            ObjectNode input = MAPPER.createObjectNode();
            input.put("message", message);
            addAction(actions, "coordinate_workflow", input, "Coordinate the team");
        }

        root.put("reply", actions.isEmpty()
                ? "Understood. Let me know which leads or tasks you want me to look at."
                : "On it. I have queued " + actions.size() + " step(s) for this request.");
        return root;
    }

    private static void addAction(ArrayNode actions, String tool, ObjectNode input, String summary) {
        ObjectNode action = actions.addObject();
        action.put("tool", tool);
        action.set("input", input);
        action.put("summary", summary);
    }

    private static String lastUserMessage(List<ConversationEntry> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationEntry entry = history.get(i);
            if (entry.role() == ConversationRole.USER && entry.content() != null) {
                return entry.content();
            }
        }
        return "";
    }

    @Override
    public String providerName() { return "scripted"; }

    @Override
    public String modelName() { return "scripted"; }
}
