package io.github.hatchcrm.aiemployees.persistence.repository;

import io.github.hatchcrm.aiemployees.persistence.document.ProposedActionDocument;
import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProposedActionRepository extends MongoRepository<ProposedActionDocument, String> {
    Optional<ProposedActionDocument> findByIdAndTenantId(String id, String tenantId);
    List<ProposedActionDocument> findByTenantIdAndStatusInOrderByCreatedAtDesc(String tenantId, Collection<ActionStatus> statuses);
    List<ProposedActionDocument> findBySessionIdOrderByCreatedAtAsc(String sessionId);
}
