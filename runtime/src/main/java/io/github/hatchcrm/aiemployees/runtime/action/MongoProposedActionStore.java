package io.github.hatchcrm.aiemployees.runtime.action;

import io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.ProposedActionRepository;
import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument.EXECUTION_CLAIMED_AT;
import static io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument.STATUS;

@Component
public class MongoProposedActionStore implements ProposedActionStore {

    private static final List<ActionStatus> OPEN = List.of(
            ActionStatus.PROPOSED, ActionStatus.REQUIRES_APPROVAL, ActionStatus.APPROVED);
    private static final List<ActionStatus> PENDING = List.of(
            ActionStatus.PROPOSED, ActionStatus.REQUIRES_APPROVAL);

    private final ProposedActionRepository repository;
    private final MongoTemplate mongoTemplate;

    public MongoProposedActionStore(ProposedActionRepository repository, MongoTemplate mongoTemplate) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public ProposedActionDocument create(ProposedActionDocument action) {
        return repository.insert(action);
    }

    @Override
    public Optional<ProposedActionDocument> findById(String actionId) {
        return repository.findById(actionId);
    }

    @Override
    public Optional<ProposedActionDocument> findByIdAndTenant(String actionId, String tenantId) {
        return repository.findByIdAndTenantId(actionId, tenantId);
    }

    @Override
    public List<ProposedActionDocument> findPending(String tenantId) {
        return repository.findByTenantIdAndStatusInOrderByCreatedAtDesc(tenantId, PENDING);
    }

    @Override
    public Optional<ProposedActionDocument> claimForExecution(String actionId, String approverId) {
        Instant now = Instant.now();
        Query query = new Query(Criteria.where("_id").is(actionId)
                .and(STATUS).in(OPEN)
                .and(EXECUTION_CLAIMED_AT).is(null));
        Update update = new Update()
                .set(STATUS, ActionStatus.APPROVED)
                .set(EXECUTION_CLAIMED_AT, now)
                .set("updatedAt", now);
        if (approverId != null) {
            update.set("approvedByUserId", approverId);
        }
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), ProposedActionDocument.class));
    }

    @Override
    public ProposedActionDocument markExecuted(String actionId) {
        Instant now = Instant.now();
        Update update = new Update()
                .set(STATUS, ActionStatus.EXECUTED)
                .set("executedAt", now)
                .unset("errorMessage")
                .set("updatedAt", now);
        return finish(actionId, update);
    }

    @Override
    public ProposedActionDocument markFailed(String actionId, String errorMessage) {
        Update update = new Update()
                .set(STATUS, ActionStatus.FAILED)
                .set("errorMessage", errorMessage)
                .set("updatedAt", Instant.now());
        return finish(actionId, update);
    }

    @Override
    public Optional<ProposedActionDocument> reject(String actionId, String reviewerId, String reason) {
        Query query = new Query(Criteria.where("_id").is(actionId)
                .and(STATUS).in(OPEN)
                .and(EXECUTION_CLAIMED_AT).is(null));
        Update update = new Update()
                .set(STATUS, ActionStatus.REJECTED)
                .set("approvedByUserId", reviewerId)
                .set("errorMessage", reason)
                .set("updatedAt", Instant.now());
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), ProposedActionDocument.class));
    }

    // Terminal writes only apply to the approved record the caller claimed.
    private ProposedActionDocument finish(String actionId, Update update) {
        Query query = new Query(Criteria.where("_id").is(actionId).and(STATUS).is(ActionStatus.APPROVED));
        ProposedActionDocument updated = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), ProposedActionDocument.class);
        if (updated != null) {
            return updated;
        }
        return repository.findById(actionId)
                .orElseThrow(() -> new IllegalStateException("Proposed action vanished: " + actionId));
    }
}
