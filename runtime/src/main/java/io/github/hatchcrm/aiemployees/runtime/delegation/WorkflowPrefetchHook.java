package io.github.hatchcrm.aiemployees.runtime.delegation;

import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;

import java.util.List;

/**
 * Host-application extension point that runs once before a workflow fans out. A hook may
 * fetch shared context and fold it into the branch messages. It must return the full request
 * list, rewritten or not; exceptions are logged and the original list is used.
 */
public interface WorkflowPrefetchHook {

    List<DelegationRequest> beforeFanOut(String message, List<DelegationRequest> requests, ToolContext context);
}
