package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationCoordinator;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationRequest;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationResult;
import io.github.hatchcrm.aiemployees.runtime.persona.PersonaCatalog;
import io.github.hatchcrm.aiemployees.runtime.session.ConversationHistoryService;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.github.hatchcrm.aiemployees.tools.LeadJson.MAPPER;

/**
 * Fans one request out to several personas and returns their replies together. Entries of
 * {@code requests} (or {@code tasks}) that name no resolvable persona are skipped; an entry
 * without its own message gets the workflow message.
 */
public class CoordinateWorkflowTool implements Tool {

    private DelegationCoordinator delegationCoordinator;
    private ConversationHistoryService conversationHistoryService;
    private PersonaCatalog personaCatalog;

    @Override public String key() { return "coordinate_workflow"; }

    @Override public String description() {
        return "Coordinate multiple AI employees: ask each for input and return combined responses.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("message").put("type", "string");
        ObjectNode item = props.putObject("requests").put("type", "array").putObject("items");
        item.put("type", "object");
        ObjectNode itemProps = item.putObject("properties");
        itemProps.putObject("persona").put("type", "string");
        itemProps.putObject("message").put("type", "string");
        props.putObject("tasks").put("type", "array");
        return schema;
    }

    @Override public boolean allowAutoRun() { return true; }
    @Override public boolean defaultRequiresApproval() { return false; }
    @Override public Duration timeout() { return Duration.ofMinutes(10); }

    public void setDelegationCoordinator(DelegationCoordinator delegationCoordinator) {
        this.delegationCoordinator = delegationCoordinator;
    }

    public void setConversationHistoryService(ConversationHistoryService conversationHistoryService) {
        this.conversationHistoryService = conversationHistoryService;
    }

    public void setPersonaCatalog(PersonaCatalog personaCatalog) {
        this.personaCatalog = personaCatalog;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (delegationCoordinator == null) {
            return ToolResult.failure("Delegation coordinator not available");
        }
        String message = LeadJson.firstText(input, "message");
        if (message == null) {
            message = DelegateToEmployeeTool.latestUserMessage(conversationHistoryService, ctx);
        }
        String rawMessage = message == null ? "" : message;

        List<DelegationResult> results = delegationCoordinator.coordinate(explicitRequests(input, rawMessage), rawMessage, ctx);

        ObjectNode output = MAPPER.createObjectNode();
        ArrayNode array = output.putArray("results");
        results.forEach(r -> array.add(MAPPER.valueToTree(r)));
        return ToolResult.success(output);
    }

    List<DelegationRequest> explicitRequests(JsonNode input, String fallbackMessage) {
        JsonNode entries = input.has("requests") ? input.get("requests") : input.get("tasks");
        if (entries == null || !entries.isArray()) return List.of();

        List<DelegationRequest> requests = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (!entry.isObject()) continue;
            String persona = LeadJson.firstText(entry, DelegateToEmployeeTool.PERSONA_FIELDS);
            if (persona == null) continue;
            Optional<String> personaKey = resolveKey(persona);
            if (personaKey.isEmpty()) continue;
            String message = LeadJson.firstText(entry, DelegateToEmployeeTool.MESSAGE_FIELDS);
            requests.add(new DelegationRequest(personaKey.get(), message != null ? message : fallbackMessage));
        }
        return requests;
    }

    private Optional<String> resolveKey(String persona) {
        if (personaCatalog == null) {
            return Optional.of(persona);
        }
        return personaCatalog.resolvePersona(persona).map(PersonaTemplateDocument::getKey);
    }
}
