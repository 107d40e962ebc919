package io.github.hatchcrm.aiemployees.tools;

public record SmsMessage(
        String tenantId,
        String leadId,
        String userId,
        String from,
        String to,
        String body,
        boolean overrideQuietHours,
        boolean transactional
) {
}
