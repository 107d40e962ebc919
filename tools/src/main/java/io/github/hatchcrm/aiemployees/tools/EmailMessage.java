package io.github.hatchcrm.aiemployees.tools;

public record EmailMessage(
        String tenantId,
        String leadId,
        String userId,
        String from,
        String to,
        String subject,
        String body,
        boolean includeUnsubscribe
) {
}
