package io.github.hatchcrm.aiemployees.runtime.session;

import io.github.hatchcrm.aiemployees.persistence.document.SessionDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookup-or-create of conversation sessions keyed by the full
 * (instance, tenant, user, channel, contextType, contextId) tuple.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    public static final String DEFAULT_CHANNEL = "web_chat";

    private final SessionRepository sessionRepository;
    private final MongoTemplate mongoTemplate;

    public SessionService(SessionRepository sessionRepository, MongoTemplate mongoTemplate) {
        this.sessionRepository = sessionRepository;
        this.mongoTemplate = mongoTemplate;
    }

    public SessionDocument upsertSession(String personaInstanceId, String tenantId, String userId,
                                         String channel, String contextType, String contextId) {
        String resolvedChannel = blankToNull(channel) != null ? channel.trim() : DEFAULT_CHANNEL;
        String resolvedContextType = blankToNull(contextType);
        String resolvedContextId = blankToNull(contextId);

        Optional<SessionDocument> existing = find(personaInstanceId, tenantId, userId,
                resolvedChannel, resolvedContextType, resolvedContextId);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = Instant.now();
        SessionDocument doc = new SessionDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setPersonaInstanceId(personaInstanceId);
        doc.setTenantId(tenantId);
        doc.setUserId(userId);
        doc.setChannel(resolvedChannel);
        doc.setContextType(resolvedContextType);
        doc.setContextId(resolvedContextId);
        doc.setCreatedAt(now);
        doc.setLastInteractionAt(now);
        try {
            SessionDocument saved = sessionRepository.insert(doc);
            log.debug("Created session {} for instance {} user {}", saved.getId(), personaInstanceId, userId);
            return saved;
        } catch (DuplicateKeyException e) {
            // another request created the same scope first
            return find(personaInstanceId, tenantId, userId, resolvedChannel, resolvedContextType, resolvedContextId)
                    .orElseThrow(() -> e);
        }
    }

    public void touch(String sessionId) {
        mongoTemplate.updateFirst(
                new Query(Criteria.where("_id").is(sessionId)),
                new Update().set("lastInteractionAt", Instant.now()),
                SessionDocument.class);
    }

    private Optional<SessionDocument> find(String personaInstanceId, String tenantId, String userId,
                                           String channel, String contextType, String contextId) {
        return sessionRepository.findByPersonaInstanceIdAndTenantIdAndUserIdAndChannelAndContextTypeAndContextId(
                personaInstanceId, tenantId, userId, channel, contextType, contextId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
