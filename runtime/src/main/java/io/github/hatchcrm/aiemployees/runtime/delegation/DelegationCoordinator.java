package io.github.hatchcrm.aiemployees.runtime.delegation;

import io.github.hatchcrm.aiemployees.persistence.document.PersonaInstanceDocument;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import io.github.hatchcrm.aiemployees.protocol.api.ActionView;
import io.github.hatchcrm.aiemployees.protocol.api.ChatResponse;
import io.github.hatchcrm.aiemployees.runtime.conversation.ChatTurnRequest;
import io.github.hatchcrm.aiemployees.runtime.conversation.ConversationService;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.persona.PersonaCatalog;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lets one persona hand a message to another and collects the replies. Nested turns run on the
 * {@code workflow} channel, keyed to the calling session.
 */
@Service
public class DelegationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DelegationCoordinator.class);

    public static final String WORKFLOW_CHANNEL = "workflow";
    public static final int MAX_FANOUT = 5;

    /** Personas a workflow message can address by name. */
    public static final Set<String> WORKFLOW_PERSONA_KEYS = Set.of(
            "agent_copilot", "lead_nurse", "listing_concierge", "market_analyst", "transaction_coordinator");

    private final PersonaCatalog personaCatalog;
    private final ConversationService conversationService;
    private final ObjectProvider<WorkflowPrefetchHook> prefetchHooks;
    private final int maxDepth;

    public DelegationCoordinator(PersonaCatalog personaCatalog,
                                 ConversationService conversationService,
                                 ObjectProvider<WorkflowPrefetchHook> prefetchHooks,
                                 @Value("${hatch.ai.delegation.max-depth:3}") int maxDepth) {
        this.personaCatalog = personaCatalog;
        this.conversationService = conversationService;
        this.prefetchHooks = prefetchHooks;
        this.maxDepth = maxDepth;
    }

    /**
     * Runs one nested turn on the referenced persona.
     *
     * @return the delegate's reply, or {@code null} when the target is the caller itself
     * @throws BadRequestException unknown persona, no active instance, blank message or depth exceeded
     */
    public DelegationResult delegate(String personaRef, String message, ToolContext context) {
        PersonaTemplateDocument template = personaCatalog.resolvePersona(personaRef)
                .orElseThrow(() -> new BadRequestException("Unknown persona: " + personaRef));
        PersonaInstanceDocument target = personaCatalog.findActiveInstance(context.tenantId(), template.getKey())
                .orElseThrow(() -> new BadRequestException("No active AI employee instance found for " + template.getKey()));
        if (target.getId().equals(context.employeeInstanceId())) {
            log.debug("Skipping self-delegation to {}", template.getKey());
            return null;
        }
        if (message == null || message.isBlank()) {
            throw new BadRequestException("Missing message for delegation");
        }
        int depth = context.delegationDepth() + 1;
        if (depth > maxDepth) {
            throw new BadRequestException("Delegation depth limit of " + maxDepth + " reached");
        }

        log.info("Delegating to {} (depth {}) from session {}", template.getKey(), depth, context.sessionId());
        ChatResponse response = conversationService.sendMessage(new ChatTurnRequest(
                context.tenantId(), target.getId(), context.actorId(),
                WORKFLOW_CHANNEL, WORKFLOW_CHANNEL, context.sessionId(), message, depth));

        List<String> toolReplies = response.actions() == null ? List.of() : response.actions().stream()
                .filter(a -> a.status() == ActionStatus.EXECUTED)
                .map(ActionView::humanReadableResult)
                .filter(text -> text != null && !text.isBlank())
                .map(String::trim)
                .toList();

        return new DelegationResult(template.getKey(), PersonaCatalog.displayName(target, template), target.getId(),
                response.reply(), toolReplies.isEmpty() ? null : toolReplies, null);
    }

    /**
     * Fans a message out to several personas, one after another. Explicit requests win over
     * requests derived from the message. One failing branch does not affect the others.
     */
    public List<DelegationResult> coordinate(List<DelegationRequest> explicitRequests, String message, ToolContext context) {
        String rawMessage = message != null ? message : "";
        List<DelegationRequest> requests = explicitRequests != null && !explicitRequests.isEmpty()
                ? explicitRequests
                : extractRequests(rawMessage);
        requests = applyHooks(rawMessage, requests, context);
        if (requests.size() > MAX_FANOUT) {
            requests = requests.subList(0, MAX_FANOUT);
        }

        List<DelegationResult> results = new ArrayList<>();
        for (DelegationRequest request : requests) {
            try {
                DelegationResult result = delegate(request.personaKey(), request.message(), context);
                if (result != null) {
                    results.add(result);
                }
            } catch (RuntimeException e) {
                log.warn("Workflow branch {} failed: {}", request.personaKey(), e.getMessage());
                results.add(DelegationResult.failed(request.personaKey(), personaName(request.personaKey()),
                        e.getMessage() != null ? e.getMessage() : "Error delegating request"));
            }
        }
        return results;
    }

    /**
     * Derives branch requests from free text: {@code Name: task} segments first, otherwise
     * every persona named anywhere in the message receives the whole message.
     */
    public List<DelegationRequest> extractRequests(String message) {
        String trimmed = message == null ? "" : message.trim();
        if (trimmed.isEmpty()) return List.of();

        List<PersonaTemplateDocument> personas = personaCatalog.activeTemplates().stream()
                .filter(t -> WORKFLOW_PERSONA_KEYS.contains(t.getKey()))
                .filter(t -> t.getDisplayName() != null && !t.getDisplayName().isBlank())
                .toList();
        if (personas.isEmpty()) return List.of();

        String names = personas.stream()
                .map(t -> Pattern.quote(t.getDisplayName()))
                .collect(Collectors.joining("|"));
        Pattern segment = Pattern.compile(
                "\\b(" + names + ")\\b\\s*:\\s*([\\s\\S]*?)(?=\\b(?:" + names + ")\\b\\s*:|$)",
                Pattern.CASE_INSENSITIVE);

        List<DelegationRequest> requests = new ArrayList<>();
        Matcher matcher = segment.matcher(trimmed);
        boolean anySegment = false;
        while (matcher.find()) {
            anySegment = true;
            String task = matcher.group(2).trim();
            Optional<PersonaTemplateDocument> persona = personaCatalog.resolvePersona(matcher.group(1));
            if (persona.isEmpty() || task.isEmpty()) continue;
            requests.add(new DelegationRequest(persona.get().getKey(), task));
        }
        if (anySegment) return requests;

        for (PersonaTemplateDocument persona : personas) {
            Pattern mention = Pattern.compile("\\b" + Pattern.quote(persona.getDisplayName()) + "\\b", Pattern.CASE_INSENSITIVE);
            if (mention.matcher(trimmed).find()) {
                requests.add(new DelegationRequest(persona.getKey(), trimmed));
            }
        }
        return requests;
    }

    private List<DelegationRequest> applyHooks(String message, List<DelegationRequest> requests, ToolContext context) {
        List<DelegationRequest> current = requests;
        for (WorkflowPrefetchHook hook : prefetchHooks.orderedStream().toList()) {
            try {
                List<DelegationRequest> rewritten = hook.beforeFanOut(message, current, context);
                if (rewritten != null) {
                    current = rewritten;
                }
            } catch (RuntimeException e) {
                log.warn("Workflow prefetch hook {} failed: {}", hook.getClass().getSimpleName(), e.getMessage());
            }
        }
        return current;
    }

    private String personaName(String personaKey) {
        return personaCatalog.resolvePersona(personaKey)
                .map(PersonaTemplateDocument::getDisplayName)
                .orElse(personaKey);
    }
}
