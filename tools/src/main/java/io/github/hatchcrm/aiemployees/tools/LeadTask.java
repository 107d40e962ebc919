package io.github.hatchcrm.aiemployees.tools;

import java.time.Instant;

public record LeadTask(
        String id,
        String title,
        Instant dueAt,
        String leadId,
        String assigneeId
) {
}
