package io.github.hatchcrm.aiemployees.gateway.controller;

import io.github.hatchcrm.aiemployees.protocol.api.ActionView;
import io.github.hatchcrm.aiemployees.protocol.api.ChatResponse;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaInstanceDto;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaTemplateDto;
import io.github.hatchcrm.aiemployees.protocol.api.ReviewActionRequest;
import io.github.hatchcrm.aiemployees.protocol.api.SendMessageRequest;
import io.github.hatchcrm.aiemployees.protocol.api.UpdateAutonomyRequest;
import io.github.hatchcrm.aiemployees.protocol.api.UpdateTemplateRequest;
import io.github.hatchcrm.aiemployees.protocol.api.UsageStatsDto;
import io.github.hatchcrm.aiemployees.runtime.action.ActionExecutionEngine;
import io.github.hatchcrm.aiemployees.runtime.conversation.ChatTurnRequest;
import io.github.hatchcrm.aiemployees.runtime.conversation.ConversationService;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.persona.PersonaCatalog;
import io.github.hatchcrm.aiemployees.runtime.usage.UsageStatsService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Persona chat, action review and administration. The caller is identified by the
 * {@code X-Tenant-Id}, {@code X-User-Id} and optional {@code X-User-Role} headers set by the
 * upstream auth layer.
 */
@RestController
@RequestMapping("/api/ai-employees")
public class AiEmployeeController {

    static final String DEFAULT_CHANNEL = "web_chat";

    private final PersonaCatalog personaCatalog;
    private final ConversationService conversationService;
    private final ActionExecutionEngine actionExecutionEngine;
    private final UsageStatsService usageStatsService;

    public AiEmployeeController(PersonaCatalog personaCatalog,
                                ConversationService conversationService,
                                ActionExecutionEngine actionExecutionEngine,
                                UsageStatsService usageStatsService) {
        this.personaCatalog = personaCatalog;
        this.conversationService = conversationService;
        this.actionExecutionEngine = actionExecutionEngine;
        this.usageStatsService = usageStatsService;
    }

    @GetMapping("/templates")
    public List<PersonaTemplateDto> listTemplates() {
        return personaCatalog.listTemplates();
    }

    @PatchMapping("/templates/{key}")
    public PersonaTemplateDto updateTemplate(@PathVariable String key,
                                             @RequestHeader(value = "X-User-Role", required = false) String role,
                                             @RequestBody UpdateTemplateRequest request) {
        return personaCatalog.updateTemplate(key, request, role);
    }

    @GetMapping("/instances")
    public List<PersonaInstanceDto> listInstances(@RequestHeader("X-Tenant-Id") String tenantId) {
        return personaCatalog.listInstances(tenantId);
    }

    @PatchMapping("/instances/{id}")
    public PersonaInstanceDto updateInstance(@PathVariable String id,
                                             @RequestHeader("X-Tenant-Id") String tenantId,
                                             @RequestHeader(value = "X-User-Role", required = false) String role,
                                             @RequestBody UpdateAutonomyRequest request) {
        return personaCatalog.updateAutonomyMode(tenantId, id, request.autonomyMode(), role);
    }

    @PostMapping("/{instanceId}/chat")
    public ChatResponse chat(@PathVariable String instanceId,
                             @RequestHeader("X-Tenant-Id") String tenantId,
                             @RequestHeader("X-User-Id") String userId,
                             @RequestBody SendMessageRequest request) {
        if (request == null) {
            throw new BadRequestException("Message is required");
        }
        String channel = request.channel() != null && !request.channel().isBlank() ? request.channel() : DEFAULT_CHANNEL;
        return conversationService.sendMessage(new ChatTurnRequest(tenantId, instanceId, userId,
                channel, request.contextType(), request.contextId(), request.message()));
    }

    @GetMapping("/actions")
    public List<ActionView> pendingActions(@RequestHeader("X-Tenant-Id") String tenantId) {
        return actionExecutionEngine.listPendingActions(tenantId);
    }

    @PostMapping("/actions/{id}/approve")
    public ActionView approve(@PathVariable String id,
                              @RequestHeader("X-Tenant-Id") String tenantId,
                              @RequestHeader("X-User-Id") String userId,
                              @RequestBody(required = false) ReviewActionRequest request) {
        return actionExecutionEngine.approveAction(tenantId, id, userId, request != null ? request.note() : null);
    }

    @PostMapping("/actions/{id}/reject")
    public ActionView reject(@PathVariable String id,
                             @RequestHeader("X-Tenant-Id") String tenantId,
                             @RequestHeader("X-User-Id") String userId,
                             @RequestBody(required = false) ReviewActionRequest request) {
        return actionExecutionEngine.rejectAction(tenantId, id, userId, request != null ? request.note() : null);
    }

    @GetMapping("/usage")
    public List<UsageStatsDto> usage(@RequestHeader("X-Tenant-Id") String tenantId,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return usageStatsService.usageStats(tenantId, from, to);
    }
}
