package com.agentrelay.agent;

import com.agentrelay.models.InterventionOutcome;
import com.agentrelay.models.ToolCallStatus;

/**
 * What a running agent may do with the relay: check for cancellation, report progress to
 * the operator, and pause for a human decision.
 */
public interface AgentContext {

    String taskKey();

    String prompt();

    /**
     * @throws com.agentrelay.TaskCancelledException if the task has been cancelled
     */
    void checkpoint();

    boolean isCancelled();

    /**
     * Report a tool call to the operator. Runs a checkpoint first, so a cancelled task
     * stops at its next progress report.
     */
    void reportToolCall(String name, String details, ToolCallStatus status);

    /**
     * Block until the operator completes the intervention, the task is cancelled, or the
     * relay's intervention timeout elapses.
     */
    InterventionOutcome requestHumanIntervention(String reason);
}
