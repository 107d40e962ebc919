package io.github.hatchcrm.aiemployees.persistence.repository;

import io.github.hatchcrm.aiemployees.persistence.document.PersonaInstanceDocument;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface PersonaInstanceRepository extends MongoRepository<PersonaInstanceDocument, String> {
    Optional<PersonaInstanceDocument> findByIdAndTenantId(String id, String tenantId);
    List<PersonaInstanceDocument> findByTenantId(String tenantId);
    List<PersonaInstanceDocument> findByTenantIdAndStatusNot(String tenantId, PersonaStatus status);
    Optional<PersonaInstanceDocument> findFirstByTenantIdAndTemplateKeyAndStatus(
            String tenantId, String templateKey, PersonaStatus status);
}
