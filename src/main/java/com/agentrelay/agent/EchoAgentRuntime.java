package com.agentrelay.agent;

import com.agentrelay.models.InterventionOutcome;
import com.agentrelay.models.ToolCallStatus;

import java.time.Duration;

/**
 * Browserless runtime that walks through a short scripted plan for the prompt. It lets the
 * relay be exercised end to end (progress, interventions, cancellation) without a browser.
 *
 * <p>A prompt containing {@code "[intervention]"} pauses for a human decision midway.</p>
 */
public class EchoAgentRuntime implements AgentRuntime {

    static final String INTERVENTION_MARKER = "[intervention]";

    private final Duration stepDelay;

    public EchoAgentRuntime() {
        this(Duration.ofMillis(250));
    }

    public EchoAgentRuntime(Duration stepDelay) {
        this.stepDelay = stepDelay;
    }

    @Override
    public String name() {
        return "echo";
    }

    @Override
    public BrowserSession openSession(String taskKey) {
        return new BrowserSession() {
            @Override
            public void start() {
            }

            @Override
            public void close() {
            }

            @Override
            public void abortCurrentOperation() {
            }
        };
    }

    @Override
    public AutomationAgent createAgent(String prompt, BrowserSession session) {
        return new EchoAgent(stepDelay);
    }

    static final class EchoAgent implements AutomationAgent {

        private static final String[] PLAN = {"go_to_url", "extract_content", "done"};

        private final Duration stepDelay;
        private final AgentState state = new AgentState();

        EchoAgent(Duration stepDelay) {
            this.stepDelay = stepDelay;
        }

        @Override
        public AgentResult run(AgentContext context) throws InterruptedException {
            for (String step : PLAN) {
                if (state.isStopped()) {
                    return AgentResult.failure("Agent stopped before " + step);
                }
                context.reportToolCall(step, "Echo step for: " + context.prompt(), ToolCallStatus.IN_PROGRESS);
                Thread.sleep(stepDelay.toMillis());
                context.reportToolCall(step, "Echo step finished", ToolCallStatus.COMPLETED);

                if ("extract_content".equals(step) && context.prompt().contains(INTERVENTION_MARKER)) {
                    InterventionOutcome outcome = context.requestHumanIntervention("Echo agent needs confirmation");
                    if (!outcome.isSuccess()) {
                        return AgentResult.failure(outcome.getMessage());
                    }
                }
            }
            return AgentResult.success("Echo: " + context.prompt());
        }

        @Override
        public void stop() {
            state.markStopped();
        }

        @Override
        public AgentState state() {
            return state;
        }
    }
}
