package com.agentrelay.agent;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable agent state shared between the agent's loop and the relay's cancellation path.
 */
public class AgentState {

    private volatile boolean stopped;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public boolean isStopped() {
        return stopped;
    }

    public void markStopped() {
        this.stopped = true;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    /**
     * Push the failure counter past {@code maxFailures} so a retry loop gives up at its next
     * decision point. Never lowers the counter.
     */
    public void exhaustRetries(int maxFailures) {
        consecutiveFailures.accumulateAndGet(maxFailures + 1, Math::max);
    }
}
