package com.agentrelay.agent;

/**
 * Final outcome reported by an {@link AutomationAgent}.
 */
public class AgentResult {

    private final String content;
    private final boolean success;

    public AgentResult(String content, boolean success) {
        this.content = content;
        this.success = success;
    }

    public static AgentResult success(String content) {
        return new AgentResult(content, true);
    }

    public static AgentResult failure(String content) {
        return new AgentResult(content, false);
    }

    public String getContent() {
        return content;
    }

    public boolean isSuccess() {
        return success;
    }
}
