package io.github.hatchcrm.aiemployees.runtime.usage;

import io.github.hatchcrm.aiemployees.persistence.document.ExecutionLogDocument;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaInstanceDocument;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.ExecutionLogRepository;
import io.github.hatchcrm.aiemployees.persistence.repository.PersonaInstanceRepository;
import io.github.hatchcrm.aiemployees.persistence.repository.PersonaTemplateRepository;
import io.github.hatchcrm.aiemployees.protocol.api.UsageStatsDto;
import io.github.hatchcrm.aiemployees.runtime.action.ExecutionLogService;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.session.ConversationHistoryService;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Per-persona tool execution counts for a tenant over a time window. */
@Service
public class UsageStatsService {

    public static final Duration DEFAULT_WINDOW = Duration.ofDays(30);

    private final ExecutionLogRepository executionLogRepository;
    private final PersonaInstanceRepository instanceRepository;
    private final PersonaTemplateRepository templateRepository;

    public UsageStatsService(ExecutionLogRepository executionLogRepository,
                             PersonaInstanceRepository instanceRepository,
                             PersonaTemplateRepository templateRepository) {
        this.executionLogRepository = executionLogRepository;
        this.instanceRepository = instanceRepository;
        this.templateRepository = templateRepository;
    }

    public List<UsageStatsDto> usageStats(String tenantId, Instant from, Instant to) {
        Instant windowEnd = to != null ? to : Instant.now();
        Instant windowStart = from != null ? from : windowEnd.minus(DEFAULT_WINDOW);
        if (windowStart.isAfter(windowEnd)) {
            throw new BadRequestException("from date must be before to date");
        }

        List<ExecutionLogDocument> rows = executionLogRepository
                .findByTenantIdAndCreatedAtBetween(tenantId, windowStart, windowEnd).stream()
                .filter(row -> isToolExecution(row.getToolKey()))
                .toList();
        if (rows.isEmpty()) {
            return List.of();
        }

        Set<String> instanceIds = rows.stream()
                .map(ExecutionLogDocument::getEmployeeInstanceId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<String, String> templateKeyByInstance = new HashMap<>();
        for (PersonaInstanceDocument instance : instanceRepository.findAllById(instanceIds)) {
            templateKeyByInstance.put(instance.getId(), instance.getTemplateKey());
        }
        Map<String, PersonaTemplateDocument> templates = templateRepository
                .findAllById(new HashSet<>(templateKeyByInstance.values())).stream()
                .collect(Collectors.toMap(PersonaTemplateDocument::getKey, Function.identity()));

        Map<String, Accumulator> stats = new LinkedHashMap<>();
        for (ExecutionLogDocument row : rows) {
            PersonaTemplateDocument template = templates.get(templateKeyByInstance.get(row.getEmployeeInstanceId()));
            if (template == null) continue;
            Accumulator acc = stats.computeIfAbsent(template.getKey(),
                    k -> new Accumulator(template.getKey(), template.getDisplayName()));
            acc.total++;
            if (row.isSuccess()) acc.success++; else acc.failed++;
            acc.tools.merge(row.getToolKey() != null ? row.getToolKey() : "unknown", 1L, Long::sum);
        }

        return stats.values().stream()
                .sorted(Comparator.comparing(a -> a.personaKey))
                .map(a -> new UsageStatsDto(a.personaKey, a.personaName, a.total, a.success, a.failed,
                        a.tools, windowStart, windowEnd))
                .toList();
    }

    private static boolean isToolExecution(String toolKey) {
        return toolKey == null
                || !(toolKey.startsWith(ConversationHistoryService.CONVERSATION_PREFIX)
                || toolKey.startsWith(ExecutionLogService.REVIEW_PREFIX));
    }

    private static final class Accumulator {
        final String personaKey;
        final String personaName;
        long total;
        long success;
        long failed;
        final Map<String, Long> tools = new TreeMap<>();

        Accumulator(String personaKey, String personaName) {
            this.personaKey = personaKey;
            this.personaName = personaName;
        }
    }
}
