package io.github.hatchcrm.aiemployees.runtime.action;

import io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for proposed actions. Every transition is conditional on the current
 * state, so two callers racing on the same action cannot both win.
 */
public interface ProposedActionStore {

    ProposedActionDocument create(ProposedActionDocument action);

    Optional<ProposedActionDocument> findById(String actionId);

    Optional<ProposedActionDocument> findByIdAndTenant(String actionId, String tenantId);

    List<ProposedActionDocument> findPending(String tenantId);

    /**
     * Moves a non-terminal, unclaimed action to {@code approved} and stamps the execution claim.
     * Empty when someone else already holds the claim or the action has reached a terminal state.
     */
    Optional<ProposedActionDocument> claimForExecution(String actionId, String approverId);

    ProposedActionDocument markExecuted(String actionId);

    ProposedActionDocument markFailed(String actionId, String errorMessage);

    /** Empty when the action is terminal or currently claimed for execution. */
    Optional<ProposedActionDocument> reject(String actionId, String reviewerId, String reason);
}
