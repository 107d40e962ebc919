package io.github.hatchcrm.aiemployees.runtime.conversation;

import io.github.hatchcrm.aiemployees.persistence.document.PersonaInstanceDocument;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.persistence.document.SessionDocument;
import io.github.hatchcrm.aiemployees.protocol.api.ActionView;
import io.github.hatchcrm.aiemployees.protocol.api.ChatResponse;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationEntry;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationRole;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaStatus;
import io.github.hatchcrm.aiemployees.runtime.action.ActionExecutionEngine;
import io.github.hatchcrm.aiemployees.runtime.action.ActionScope;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.error.ForbiddenException;
import io.github.hatchcrm.aiemployees.runtime.llm.ModelCallService;
import io.github.hatchcrm.aiemployees.runtime.llm.SystemPromptBuilder;
import io.github.hatchcrm.aiemployees.runtime.persona.PersonaCatalog;
import io.github.hatchcrm.aiemployees.runtime.plan.AssistantPlan;
import io.github.hatchcrm.aiemployees.runtime.plan.PlanParser;
import io.github.hatchcrm.aiemployees.runtime.session.ConversationHistoryService;
import io.github.hatchcrm.aiemployees.runtime.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a single chat turn: session, history, model call, plan parsing and action intake.
 * Turn-level failures propagate; per-action failures stay on the action records.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    public static final String DRY_RUN_SETTING = "dryRun";

    private final PersonaCatalog personaCatalog;
    private final SessionService sessionService;
    private final ConversationHistoryService historyService;
    private final SystemPromptBuilder promptBuilder;
    private final ModelCallService modelCallService;
    private final PlanParser planParser;
    private final ActionExecutionEngine executionEngine;
    private final int maxDelegationDepth;

    public ConversationService(PersonaCatalog personaCatalog,
                               SessionService sessionService,
                               ConversationHistoryService historyService,
                               SystemPromptBuilder promptBuilder,
                               ModelCallService modelCallService,
                               PlanParser planParser,
                               ActionExecutionEngine executionEngine,
                               @Value("${hatch.ai.delegation.max-depth:3}") int maxDelegationDepth) {
        this.personaCatalog = personaCatalog;
        this.sessionService = sessionService;
        this.historyService = historyService;
        this.promptBuilder = promptBuilder;
        this.modelCallService = modelCallService;
        this.planParser = planParser;
        this.executionEngine = executionEngine;
        this.maxDelegationDepth = maxDelegationDepth;
    }

    public ChatResponse sendMessage(ChatTurnRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            throw new BadRequestException("Message is required");
        }
        if (request.delegationDepth() > maxDelegationDepth) {
            throw new BadRequestException("Delegation depth limit of " + maxDelegationDepth + " reached");
        }

        PersonaInstanceDocument instance = personaCatalog.requireInstance(request.tenantId(), request.personaInstanceId());
        if (instance.getStatus() != PersonaStatus.ACTIVE) {
            throw new ForbiddenException("AI employee is not active");
        }
        PersonaTemplateDocument template = personaCatalog.findTemplate(instance.getTemplateKey()).orElse(null);
        String message = request.message().trim();

        SessionDocument session = sessionService.upsertSession(instance.getId(), request.tenantId(), request.userId(),
                request.channel(), request.contextType(), request.contextId());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("channel", session.getChannel());
        metadata.put("contextType", session.getContextType());
        metadata.put("contextId", session.getContextId());
        historyService.recordTurn(session, request.userId(), ConversationRole.USER, message, metadata);

        // history already ends with the user turn recorded above
        List<ConversationEntry> history = historyService.loadHistory(session.getId());

        String instanceName = PersonaCatalog.displayName(instance, template);
        List<String> allowedTools = PersonaCatalog.allowedTools(template);
        Map<String, Object> settings = PersonaCatalog.mergedSettings(template, instance);
        String systemPrompt = promptBuilder.build(template != null ? template.getSystemPrompt() : null,
                instanceName, instance.getAutonomyMode(), allowedTools, settings);

        String raw = modelCallService.complete(session, systemPrompt, history);
        AssistantPlan plan = planParser.parse(raw, allowedTools);

        historyService.recordTurn(session, request.userId(), ConversationRole.ASSISTANT, plan.reply(),
                Map.of("actionCount", plan.actions().size()));
        sessionService.touch(session.getId());

        ActionScope scope = new ActionScope(request.tenantId(), instance.getId(), session.getId(), request.userId(),
                instance.getAutonomyMode(), isDryRun(settings), request.delegationDepth());
        List<ActionView> actions = executionEngine.intake(scope, plan.actions());

        log.info("Turn for {} in session {} produced {} action(s)", instanceName, session.getId(), actions.size());
        return new ChatResponse(session.getId(), instance.getId(), plan.reply(), actions);
    }

    static boolean isDryRun(Map<String, Object> settings) {
        Object value = settings.get(DRY_RUN_SETTING);
        return Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value));
    }
}
