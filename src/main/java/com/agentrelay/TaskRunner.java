package com.agentrelay;

import com.agentrelay.agent.AgentResult;
import com.agentrelay.agent.AgentRuntime;
import com.agentrelay.agent.AutomationAgent;
import com.agentrelay.agent.BrowserSession;
import com.agentrelay.models.TaskState;
import com.agentrelay.models.ToolCallStatus;

/**
 * Runs one admitted task: opens a browser session, runs the agent with a {@link TaskContext},
 * and hands the outcome to {@link AgentOrchestrator#finishTask}. Nothing thrown by the
 * collaborators escapes this class.
 */
class TaskRunner implements Runnable {

    private final AgentOrchestrator orchestrator;
    private final AgentRuntime runtime;
    private final TaskRecord record;
    private final TaskContext context;
    private final AppLogger logger = AppLogger.get();

    TaskRunner(AgentOrchestrator orchestrator, AgentRuntime runtime, TaskRecord record, TaskContext context) {
        this.orchestrator = orchestrator;
        this.runtime = runtime;
        this.record = record;
        this.context = context;
    }

    @Override
    public void run() {
        if (!record.markRunning()) {
            logWarning("Task " + record.getTaskKey() + " was not pending when its worker started: " + record);
            return;
        }
        String key = record.getTaskKey();
        log("Running task " + key + ": " + abbreviate(record.getPrompt()));

        TaskState terminal;
        String content;
        boolean success = false;
        BrowserSession session = null;
        try {
            context.checkpoint();
            orchestrator.telemetry().toolCall(key, "browser_agent_start",
                "Starting task: " + record.getPrompt(), ToolCallStatus.IN_PROGRESS);

            session = runtime.openSession(key);
            record.attachSession(session);
            session.start();
            context.checkpoint();

            AutomationAgent agent = runtime.createAgent(record.getPrompt(), session);
            record.attachAgent(agent);
            // A cancel that landed before the agent was attached escalated without it
            context.checkpoint();

            AgentResult result = agent.run(context);
            // An agent that stopped because it was told to still ends as cancelled
            context.checkpoint();

            terminal = TaskState.COMPLETED;
            content = result != null ? result.getContent() : null;
            success = result == null || result.isSuccess();
        } catch (TaskCancelledException e) {
            terminal = TaskState.CANCELLED;
            content = e.getMessage();
        } catch (Exception e) {
            if (context.isCancelled()) {
                terminal = TaskState.CANCELLED;
                content = new TaskCancelledException(key).getMessage();
            } else {
                terminal = TaskState.FAILED;
                content = describe(e);
                logError("Task " + key + " failed", e);
            }
        } catch (Error e) {
            orchestrator.finishTask(record, TaskState.FAILED, describe(e), false);
            closeQuietly(session);
            throw e;
        }

        closeQuietly(session);
        orchestrator.finishTask(record, terminal, content, success);
    }

    private void closeQuietly(BrowserSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (Exception e) {
            logWarning("Error closing browser session for task " + record.getTaskKey() + ": " + e.getMessage());
        }
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        if (message == null || message.isBlank()) {
            message = t.getClass().getSimpleName();
        }
        return message;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[TaskRunner] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[TaskRunner] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        if (logger != null) {
            logger.error("[TaskRunner] " + message + ": " + describe(t), t);
        }
    }
}
