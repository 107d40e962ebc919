package io.github.hatchcrm.aiemployees.runtime.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model text into an {@link AssistantPlan}. Never fails: text that is not a JSON
 * object degrades to a reply with no actions, and individual bad actions are dropped.
 */
@Component
public class PlanParser {

    private static final Logger log = LoggerFactory.getLogger(PlanParser.class);

    public static final String NO_CONTEXT_REPLY = "I do not have enough context yet.";

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public PlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AssistantPlan parse(String rawText, Collection<String> allowedTools) {
        if (rawText == null || rawText.isBlank()) {
            return AssistantPlan.replyOnly(NO_CONTEXT_REPLY);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(rawText.trim()));
        } catch (JsonProcessingException e) {
            log.warn("Model reply is not JSON, treating it as plain text: {}", e.getOriginalMessage());
            return AssistantPlan.replyOnly(rawText);
        }
        if (root == null || !root.isObject()) {
            log.warn("Model reply is not a JSON object, treating it as plain text");
            return AssistantPlan.replyOnly(rawText);
        }

        JsonNode replyNode = root.get("reply");
        String reply = replyNode != null && replyNode.isTextual() ? replyNode.asText().trim() : rawText;

        List<ValidatedAction> actions = new ArrayList<>();
        JsonNode actionsNode = root.get("actions");
        if (actionsNode != null && actionsNode.isArray()) {
            for (JsonNode candidate : actionsNode) {
                ValidatedAction action = toAction(candidate, allowedTools);
                if (action != null) actions.add(action);
            }
        }
        return new AssistantPlan(reply, actions);
    }

    private ValidatedAction toAction(JsonNode candidate, Collection<String> allowedTools) {
        if (candidate == null || !candidate.isObject()) {
            log.debug("Dropping non-object action entry");
            return null;
        }
        JsonNode toolNode = candidate.get("tool");
        if (toolNode == null || !toolNode.isTextual() || toolNode.asText().isBlank()) {
            log.debug("Dropping action without a tool key");
            return null;
        }
        String tool = toolNode.asText().trim();
        if (allowedTools == null || !allowedTools.contains(tool)) {
            log.debug("Dropping action for tool '{}' outside the allow-list", tool);
            return null;
        }

        JsonNode inputNode = candidate.get("input");
        ObjectNode input = inputNode != null && inputNode.isObject()
                ? ((ObjectNode) inputNode).deepCopy()
                : objectMapper.createObjectNode();

        JsonNode approvalNode = candidate.get("requiresApproval");
        Boolean requiresApproval = approvalNode != null && approvalNode.isBoolean() ? approvalNode.booleanValue() : null;

        JsonNode summaryNode = candidate.get("summary");
        String summary = summaryNode != null && summaryNode.isTextual() ? summaryNode.asText() : null;

        return new ValidatedAction(tool, input, requiresApproval, summary);
    }

    private static String stripCodeFence(String text) {
        Matcher m = CODE_FENCE.matcher(text);
        return m.matches() ? m.group(1) : text;
    }
}
