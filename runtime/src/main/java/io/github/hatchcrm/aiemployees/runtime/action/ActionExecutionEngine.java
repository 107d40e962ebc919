package io.github.hatchcrm.aiemployees.runtime.action;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument;
import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import io.github.hatchcrm.aiemployees.protocol.api.ActionView;
import io.github.hatchcrm.aiemployees.runtime.error.AiEmployeeException;
import io.github.hatchcrm.aiemployees.runtime.error.InvalidStateException;
import io.github.hatchcrm.aiemployees.runtime.error.NotFoundException;
import io.github.hatchcrm.aiemployees.runtime.error.RateLimitExceededException;
import io.github.hatchcrm.aiemployees.runtime.plan.ValidatedAction;
import io.github.hatchcrm.aiemployees.runtime.ratelimit.TenantRateLimiter;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the proposed-action state machine:
 * <pre>
 *   proposed / requires-approval / approved  ->  executed | failed
 *   any non-terminal, unclaimed state         ->  rejected
 * </pre>
 * Once claimed, an action always ends executed or failed, even when an unexpected error
 * interrupts the run.
 * Execution always goes through {@link ProposedActionStore#claimForExecution}, which only one
 * caller can win per action. That is what keeps a double approval from running a tool twice.
 */
@Service
public class ActionExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutionEngine.class);

    public static final String RATE_LIMIT_MESSAGE = "AI execution rate limit exceeded for this tenant. Try again later.";
    public static final String DRY_RUN_MESSAGE = "Dry run - no changes applied.";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ProposedActionStore store;
    private final ToolRegistry toolRegistry;
    private final TenantRateLimiter rateLimiter;
    private final ExecutionLogService executionLogService;
    private final ActionViewMapper viewMapper;
    private final ObjectMapper objectMapper;

    public ActionExecutionEngine(ProposedActionStore store, ToolRegistry toolRegistry, TenantRateLimiter rateLimiter,
                                 ExecutionLogService executionLogService, ActionViewMapper viewMapper,
                                 ObjectMapper objectMapper) {
        this.store = store;
        this.toolRegistry = toolRegistry;
        this.rateLimiter = rateLimiter;
        this.executionLogService = executionLogService;
        this.viewMapper = viewMapper;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Intake
    // ------------------------------------------------------------------

    /**
     * Creates one proposed action per plan entry, in plan order, and runs the ones the policy
     * allows to run straight away. A failing action never stops the ones after it.
     */
    public List<ActionView> intake(ActionScope scope, List<ValidatedAction> actions) {
        List<ActionView> views = new ArrayList<>();
        for (ValidatedAction action : actions) {
            Optional<Tool> tool = toolRegistry.get(action.tool());
            if (tool.isEmpty()) {
                log.warn("Dropping action for unregistered tool '{}' (instance {})", action.tool(), scope.employeeInstanceId());
                continue;
            }

            ActionPolicy.Decision decision = ActionPolicy.decide(tool.get(), action.requiresApproval(), scope.autonomyMode());
            ProposedActionDocument record = store.create(newRecord(scope, action, decision));
            log.debug("Action {} ({}) created as {}", record.getId(), record.getActionType(), record.getStatus().wireValue());

            if (decision.executeImmediately()) {
                record = claimAndExecute(record, scope.userId(), scope.delegationDepth(), false);
            }
            views.add(viewMapper.toView(record));
        }
        return views;
    }

    private ProposedActionDocument newRecord(ActionScope scope, ValidatedAction action, ActionPolicy.Decision decision) {
        Instant now = Instant.now();
        ProposedActionDocument doc = new ProposedActionDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setTenantId(scope.tenantId());
        doc.setEmployeeInstanceId(scope.employeeInstanceId());
        doc.setSessionId(scope.sessionId());
        doc.setUserId(scope.userId());
        doc.setActionType(action.tool());
        doc.setPayload(objectMapper.convertValue(action.input(), MAP_TYPE));
        doc.setStatus(decision.initialStatus());
        doc.setRequiresApproval(decision.requiresApproval());
        doc.setDryRun(scope.dryRun());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    // ------------------------------------------------------------------
    // Review
    // ------------------------------------------------------------------

    /**
     * Approves and runs the action. Already executed or failed actions are returned unchanged.
     *
     * @throws NotFoundException      no such action in the tenant
     * @throws InvalidStateException  the action was rejected
     * @throws AiEmployeeException    the run itself failed; the action is already marked failed
     */
    public ActionView approveAction(String tenantId, String actionId, String reviewerId, String note) {
        ProposedActionDocument action = store.findByIdAndTenant(actionId, tenantId)
                .orElseThrow(() -> new NotFoundException("Action not found"));
        if (action.getStatus() == ActionStatus.REJECTED) {
            throw new InvalidStateException("Rejected actions cannot be approved");
        }
        if (action.getStatus() == ActionStatus.EXECUTED || action.getStatus() == ActionStatus.FAILED) {
            return viewMapper.toView(action);
        }
        Optional<ProposedActionDocument> claimed = store.claimForExecution(actionId, reviewerId);
        if (claimed.isEmpty()) {
            log.debug("Action {} already claimed or finished, not executing again", actionId);
            return viewMapper.toView(store.findById(actionId).orElse(action));
        }
        log.info("Action {} ({}) approved by {}", actionId, action.getActionType(), reviewerId);
        try {
            executionLogService.recordApproval(claimed.get(), reviewerId, note);
        } catch (RuntimeException e) {
            return viewMapper.toView(failUnexpectedly(claimed.get(), reviewerId, e, true));
        }
        return viewMapper.toView(executeActionRecord(claimed.get(), 0, true));
    }

    public ActionView rejectAction(String tenantId, String actionId, String reviewerId, String reason) {
        ProposedActionDocument action = store.findByIdAndTenant(actionId, tenantId)
                .orElseThrow(() -> new NotFoundException("Action not found"));
        if (action.getStatus() == ActionStatus.REJECTED) {
            return viewMapper.toView(action);
        }
        if (action.getStatus().isTerminal()) {
            throw new InvalidStateException("Action already " + action.getStatus().wireValue() + " and cannot be rejected");
        }

        Optional<ProposedActionDocument> rejected = store.reject(actionId, reviewerId, reason);
        if (rejected.isEmpty()) {
            ProposedActionDocument current = store.findById(actionId).orElse(action);
            if (current.getStatus() == ActionStatus.REJECTED) {
                return viewMapper.toView(current);
            }
            throw new InvalidStateException("Action is already being executed and cannot be rejected");
        }
        executionLogService.recordRejection(rejected.get(), reviewerId, reason);
        log.info("Action {} ({}) rejected by {}", actionId, action.getActionType(), reviewerId);
        return viewMapper.toView(rejected.get());
    }

    public List<ActionView> listPendingActions(String tenantId) {
        return viewMapper.toViews(store.findPending(tenantId));
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    private ProposedActionDocument claimAndExecute(ProposedActionDocument action, String approverId,
                                                   int delegationDepth, boolean surfaceFailure) {
        Optional<ProposedActionDocument> claimed = store.claimForExecution(action.getId(), approverId);
        if (claimed.isEmpty()) {
            log.debug("Action {} already claimed or finished, not executing again", action.getId());
            return store.findById(action.getId()).orElse(action);
        }
        return executeActionRecord(claimed.get(), delegationDepth, surfaceFailure);
    }

    /**
     * Runs a claimed action. Exactly one execution log row is written whatever the outcome.
     * With {@code surfaceFailure} the failure is rethrown after the action is marked failed;
     * without it the failed record is returned.
     */
    ProposedActionDocument executeActionRecord(ProposedActionDocument action, int delegationDepth, boolean surfaceFailure) {
        String actorId = action.getApprovedByUserId() != null ? action.getApprovedByUserId() : action.getUserId();
        try {
            return runClaimed(action, actorId, delegationDepth, surfaceFailure);
        } catch (AiEmployeeException e) {
            // already recorded and marked failed
            throw e;
        } catch (RuntimeException e) {
            return failUnexpectedly(action, actorId, e, surfaceFailure);
        }
    }

    private ProposedActionDocument runClaimed(ProposedActionDocument action, String actorId, int delegationDepth,
                                              boolean surfaceFailure) {
        if (rateLimiter.isOverLimit(action.getTenantId())) {
            executionLogService.recordFailure(action, actorId, RATE_LIMIT_MESSAGE);
            ProposedActionDocument failed = store.markFailed(action.getId(), RATE_LIMIT_MESSAGE);
            if (surfaceFailure) {
                throw new RateLimitExceededException(RATE_LIMIT_MESSAGE);
            }
            return failed;
        }

        if (action.isDryRun()) {
            ObjectNode output = objectMapper.createObjectNode();
            output.put("dryRun", true);
            output.put("message", DRY_RUN_MESSAGE);
            executionLogService.recordSuccess(action, actorId, output);
            return store.markExecuted(action.getId());
        }

        ToolContext context = new ToolContext(action.getTenantId(), actorId, action.getSessionId(),
                action.getEmployeeInstanceId(), delegationDepth);
        JsonNode payload = action.getPayload() == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(action.getPayload());
        try {
            JsonNode output = toolRegistry.execute(action.getActionType(), payload, context);
            executionLogService.recordSuccess(action, actorId, output);
            ProposedActionDocument executed = store.markExecuted(action.getId());
            log.info("Action {} ({}) executed for tenant {}", action.getId(), action.getActionType(), action.getTenantId());
            return executed;
        } catch (AiEmployeeException e) {
            String message = e.getMessage();
            executionLogService.recordFailure(action, actorId, message);
            ProposedActionDocument failed = store.markFailed(action.getId(), message);
            if (surfaceFailure) {
                throw e;
            }
            log.warn("Action {} ({}) failed: {}", action.getId(), action.getActionType(), message);
            return failed;
        }
    }

    /**
     * Settles a claimed action after an error outside the tool's own failure handling, so the
     * claim never leaves it stuck in approved.
     */
    private ProposedActionDocument failUnexpectedly(ProposedActionDocument action, String actorId,
                                                    RuntimeException error, boolean surfaceFailure) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("Action {} ({}) failed unexpectedly", action.getId(), action.getActionType(), error);
        ProposedActionDocument failed = action;
        try {
            executionLogService.recordFailure(action, actorId, message);
            failed = store.markFailed(action.getId(), message);
        } catch (RuntimeException cleanup) {
            error.addSuppressed(cleanup);
        }
        if (surfaceFailure) {
            throw error;
        }
        return failed;
    }
}
