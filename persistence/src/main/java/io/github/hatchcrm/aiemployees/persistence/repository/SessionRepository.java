package io.github.hatchcrm.aiemployees.persistence.repository;

import io.github.hatchcrm.aiemployees.persistence.document.SessionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface SessionRepository extends MongoRepository<SessionDocument, String> {
    Optional<SessionDocument> findByPersonaInstanceIdAndTenantIdAndUserIdAndChannelAndContextTypeAndContextId(
            String personaInstanceId, String tenantId, String userId,
            String channel, String contextType, String contextId);
}
