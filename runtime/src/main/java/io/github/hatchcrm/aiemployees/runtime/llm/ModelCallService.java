package io.github.hatchcrm.aiemployees.runtime.llm;

import io.github.hatchcrm.aiemployees.persistence.document.ModelCallDocument;
import io.github.hatchcrm.aiemployees.persistence.document.SessionDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.ModelCallRepository;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationEntry;
import io.github.hatchcrm.aiemployees.runtime.error.ModelUnavailableException;
import io.github.hatchcrm.aiemployees.runtime.support.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Bounded model call for one chat turn. Every attempt, successful or not, is recorded.
 */
@Service
public class ModelCallService {

    private static final Logger log = LoggerFactory.getLogger(ModelCallService.class);

    private final ChatCompletionClient client;
    private final ModelCallRepository modelCallRepository;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;

    public ModelCallService(ChatCompletionClient client,
                            ModelCallRepository modelCallRepository,
                            TimeLimiter timeLimiter,
                            @Value("${hatch.ai.llm.timeout:60s}") Duration timeout) {
        this.client = client;
        this.modelCallRepository = modelCallRepository;
        this.timeLimiter = timeLimiter;
        this.timeout = timeout;
    }

    public String complete(SessionDocument session, String systemPrompt, List<ConversationEntry> history) {
        long start = System.currentTimeMillis();
        if (!client.isAvailable()) {
            String message = "Model provider " + client.providerName() + " is not configured";
            record(session, history.size() + 1, 0, start, false, message);
            throw new ModelUnavailableException(message);
        }
        try {
            String text = timeLimiter.call(
                    () -> client.complete(systemPrompt, history, CompletionFormat.JSON_OBJECT), timeout);
            String result = text != null ? text : "";
            record(session, history.size() + 1, result.length(), start, true, null);
            return result;
        } catch (TimeoutException e) {
            String message = "Model call timed out after " + timeout.toMillis() + " ms";
            log.warn("{} (session {})", message, session.getId());
            record(session, history.size() + 1, 0, start, false, message);
            throw new ModelUnavailableException(message, e);
        } catch (RuntimeException e) {
            log.error("Model call failed for session {}", session.getId(), e);
            record(session, history.size() + 1, 0, start, false, e.getMessage());
            throw new ModelUnavailableException("Model call failed: " + e.getMessage(), e);
        }
    }

    private void record(SessionDocument session, int messageCount, int responseChars, long start,
                        boolean success, String error) {
        ModelCallDocument doc = new ModelCallDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setTenantId(session.getTenantId());
        doc.setEmployeeInstanceId(session.getPersonaInstanceId());
        doc.setSessionId(session.getId());
        doc.setProvider(client.providerName());
        doc.setModel(client.modelName());
        doc.setMessageCount(messageCount);
        doc.setResponseChars(responseChars);
        doc.setDurationMs(System.currentTimeMillis() - start);
        doc.setSuccess(success);
        doc.setErrorMessage(error);
        doc.setTimestamp(Instant.now());
        try {
            modelCallRepository.save(doc);
        } catch (RuntimeException e) {
            log.warn("Failed to record model call for session {}: {}", session.getId(), e.getMessage());
        }
    }
}
