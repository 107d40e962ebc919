package io.github.hatchcrm.aiemployees.tools;

public record DailySummary(
        long activeLeads,
        long newLeads,
        long idleLeads,
        long openTasks,
        long dueSoonTasks
) {
}
