package io.github.hatchcrm.aiemployees.runtime.plan;

import java.util.List;

public record AssistantPlan(
        String reply,
        List<ValidatedAction> actions
) {
    public AssistantPlan {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static AssistantPlan replyOnly(String reply) {
        return new AssistantPlan(reply, List.of());
    }
}
