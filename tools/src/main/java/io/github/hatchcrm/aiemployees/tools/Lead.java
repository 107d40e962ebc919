package io.github.hatchcrm.aiemployees.tools;

import java.time.Instant;

/** A CRM person as the lead tools see it. {@code leadScore} and {@code lastActivityAt} may be null. */
public record Lead(
        String id,
        String firstName,
        String lastName,
        String stage,
        String scoreTier,
        Double leadScore,
        Instant lastActivityAt,
        Instant createdAt,
        String ownerId,
        String primaryEmail,
        String primaryPhone
) {
    public String fullName() {
        String first = firstName == null ? "" : firstName.trim();
        String last = lastName == null ? "" : lastName.trim();
        String name = (first + " " + last).trim();
        return name.isEmpty() ? "Unknown lead" : name;
    }
}
