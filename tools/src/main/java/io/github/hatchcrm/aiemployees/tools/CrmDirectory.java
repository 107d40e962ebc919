package io.github.hatchcrm.aiemployees.tools;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lead and task access supplied by the host CRM. The lead tools only shape input and output;
 * filtering, ordering and permission checks belong to the implementation.
 */
public interface CrmDirectory {

    /** Counts for the tenant; "new" covers leads created after {@code since}. */
    DailySummary dailySummary(String tenantId, Instant since);

    /** Number of open leads that {@link #hotLeads} ranks. */
    long countWorkableLeads(String tenantId);

    /** Open leads ordered by score tier, then score, then most recent activity. */
    List<Lead> hotLeads(String tenantId, int limit);

    /** Open leads with no activity since {@code idleSince}, oldest activity first. */
    List<Lead> idleLeads(String tenantId, Instant idleSince, int limit);

    /** Open tasks due before {@code now}, earliest first. */
    List<LeadTask> overdueTasks(String tenantId, Instant now, int limit);

    Optional<Lead> findLead(String tenantId, String leadId);

    /** @return the new note's id */
    String addNote(String tenantId, String actorId, String leadId, String body);

    /** @return the new task's id */
    String createTask(String tenantId, String actorId, String leadId, String title, Instant dueAt, String assigneeId);
}
