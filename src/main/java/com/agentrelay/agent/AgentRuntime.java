package com.agentrelay.agent;

/**
 * Creates the collaborators for one task. A runtime is picked up with
 * {@link java.util.ServiceLoader}; {@link EchoAgentRuntime} is used when none is installed.
 */
public interface AgentRuntime {

    String name();

    BrowserSession openSession(String taskKey) throws Exception;

    AutomationAgent createAgent(String prompt, BrowserSession session) throws Exception;
}
