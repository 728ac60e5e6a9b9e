package com.agentrelay.agent;

/**
 * The decision-making loop that drives a browser session step by step.
 *
 * <p>{@link #run} is expected to call {@link AgentContext#checkpoint()} (directly or through
 * {@link AgentContext#reportToolCall}) between steps and to honour {@link AgentState#isStopped()}
 * at its own decision points. Calls it makes into a {@link BrowserSession} may not be
 * interruptible; cancellation only takes effect once such a call returns.</p>
 */
public interface AutomationAgent {

    AgentResult run(AgentContext context) throws Exception;

    /**
     * Release the agent's resources. May be called from another thread while {@link #run}
     * is still executing.
     */
    void stop();

    AgentState state();
}
