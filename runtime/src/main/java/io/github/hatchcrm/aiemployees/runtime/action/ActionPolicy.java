package io.github.hatchcrm.aiemployees.runtime.action;

import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;
import io.github.hatchcrm.aiemployees.runtime.tools.Tool;

/**
 * Intake rules for a freshly planned action. Each rule can only tighten the previous one.
 */
public final class ActionPolicy {

    public record Decision(boolean requiresApproval, ActionStatus initialStatus, boolean executeImmediately) {}

    private ActionPolicy() {}

    public static Decision decide(Tool tool, Boolean requiresApprovalOverride, AutonomyMode autonomyMode) {
        AutonomyMode mode = autonomyMode != null ? autonomyMode : AutonomyMode.REQUIRES_APPROVAL;

        boolean requiresApproval = requiresApprovalOverride != null
                ? requiresApprovalOverride
                : tool.defaultRequiresApproval();
        if (!tool.allowAutoRun()) {
            requiresApproval = true;
        }
        if (mode.forcesApproval()) {
            requiresApproval = true;
        }

        ActionStatus initial;
        if (mode == AutonomyMode.SUGGEST_ONLY) {
            initial = ActionStatus.PROPOSED;
        } else if (requiresApproval) {
            initial = ActionStatus.REQUIRES_APPROVAL;
        } else {
            initial = ActionStatus.APPROVED;
        }

        boolean executeNow = initial == ActionStatus.APPROVED && mode == AutonomyMode.AUTO_RUN;
        return new Decision(requiresApproval, initial, executeNow);
    }
}
