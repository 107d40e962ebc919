package io.github.hatchcrm.aiemployees.runtime.session;

import io.github.hatchcrm.aiemployees.persistence.document.ExecutionLogDocument;
import io.github.hatchcrm.aiemployees.persistence.document.SessionDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.ExecutionLogRepository;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationEntry;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationRole;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Conversation turns live in the execution log under the reserved {@code conversation:} keys,
 * so history and audit share one append-only store.
 */
@Service
public class ConversationHistoryService {

    public static final String CONVERSATION_PREFIX = "conversation:";

    private final ExecutionLogRepository executionLogRepository;
    private final int historyLimit;

    public ConversationHistoryService(ExecutionLogRepository executionLogRepository,
                                      @Value("${hatch.ai.conversation.history-limit:12}") int historyLimit) {
        this.executionLogRepository = executionLogRepository;
        this.historyLimit = historyLimit;
    }

    public ExecutionLogDocument recordTurn(SessionDocument session, String actorId, ConversationRole role,
                                           String content, Map<String, Object> metadata) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("message", content);
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (v != null) input.putIfAbsent(k, v);
            });
        }

        ExecutionLogDocument entry = new ExecutionLogDocument();
        entry.setId(UUID.randomUUID().toString());
        entry.setTenantId(session.getTenantId());
        entry.setEmployeeInstanceId(session.getPersonaInstanceId());
        entry.setSessionId(session.getId());
        entry.setUserId(actorId);
        entry.setToolKey(role.logKey());
        entry.setInput(input);
        entry.setSuccess(true);
        entry.setCreatedAt(Instant.now());
        return executionLogRepository.save(entry);
    }

    public List<ConversationEntry> loadHistory(String sessionId) {
        return loadHistory(sessionId, historyLimit);
    }

    /** Most recent {@code limit} turns, oldest first. */
    public List<ConversationEntry> loadHistory(String sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ExecutionLogDocument> recent = executionLogRepository
                .findBySessionIdAndToolKeyStartingWithOrderByCreatedAtDesc(sessionId, CONVERSATION_PREFIX, PageRequest.of(0, limit));
        List<ConversationEntry> history = new ArrayList<>(recent.size());
        for (ExecutionLogDocument row : recent) {
            history.add(new ConversationEntry(ConversationRole.fromLogKey(row.getToolKey()),
                    extractMessage(row.getInput()), row.getCreatedAt()));
        }
        Collections.reverse(history);
        return history;
    }

    public Optional<String> latestUserMessage(String sessionId, String employeeInstanceId) {
        if (sessionId == null) return Optional.empty();
        return executionLogRepository
                .findFirstBySessionIdAndEmployeeInstanceIdAndToolKeyOrderByCreatedAtDesc(
                        sessionId, employeeInstanceId, ConversationRole.USER.logKey())
                .map(row -> extractMessage(row.getInput()))
                .filter(message -> !message.isBlank());
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    private static String extractMessage(Map<String, Object> input) {
        if (input == null) return "";
        Object message = input.get("message");
        return message instanceof String text ? text : "";
    }
}
