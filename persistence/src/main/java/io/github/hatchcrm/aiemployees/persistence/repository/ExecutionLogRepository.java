package io.github.hatchcrm.aiemployees.persistence.repository;

import io.github.hatchcrm.aiemployees.persistence.document.ExecutionLogDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ExecutionLogRepository extends MongoRepository<ExecutionLogDocument, String> {
    List<ExecutionLogDocument> findBySessionIdAndToolKeyStartingWithOrderByCreatedAtDesc(
            String sessionId, String toolKeyPrefix, Pageable pageable);
    Optional<ExecutionLogDocument> findFirstBySessionIdAndEmployeeInstanceIdAndToolKeyOrderByCreatedAtDesc(
            String sessionId, String employeeInstanceId, String toolKey);
    Optional<ExecutionLogDocument> findFirstByProposedActionIdAndToolKeyAndSuccessTrueOrderByCreatedAtDesc(
            String proposedActionId, String toolKey);
    List<ExecutionLogDocument> findByProposedActionIdOrderByCreatedAtAsc(String proposedActionId);
    List<ExecutionLogDocument> findByTenantIdAndCreatedAtBetween(String tenantId, Instant from, Instant to);
}
