package com.agentrelay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentrelay.agent.AgentRuntime;
import com.agentrelay.agent.AutomationAgent;
import com.agentrelay.agent.BrowserSession;
import com.agentrelay.models.AdmissionResult;
import com.agentrelay.models.TaskState;
import com.agentrelay.models.ToolCallStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Owns the relay's process-wide state: the controller connection, the task registry, the
 * cancellation coordinator and pending interventions. One instance is created at startup and
 * passed to the message dispatcher and controllers.
 *
 * <p>Cancellation is cooperative. A worker blocked inside an uninterruptible browser call is
 * only reclaimed after that call returns; until then its registry entry stays live and a new
 * request for the same task key is answered as a duplicate.</p>
 */
public class AgentOrchestrator {

    /**
     * What a targeted kill ended up doing.
     */
    public enum CancelOutcome {
        /** The live task for the key was signalled. */
        TARGETED,
        /** No live task for the key; every live task was cancelled instead. */
        FALLBACK_ALL,
        /** No live task for the key and nothing else to cancel. */
        NOT_FOUND
    }

    private final AppConfig config;
    private final AgentRuntime runtime;
    private final ConnectionHandle connection;
    private final TelemetryEmitter telemetry;
    private final InterventionRendezvous rendezvous;
    private final CancellationCoordinator coordinator;
    private final TaskRegistry registry;
    private final ExecutorService executor;
    private final AppLogger logger = AppLogger.get();

    public AgentOrchestrator(AppConfig config, ObjectMapper objectMapper, AgentRuntime runtime) {
        this.config = config;
        this.runtime = runtime;
        this.connection = new ConnectionHandle();
        this.telemetry = new TelemetryEmitter(connection, objectMapper);
        this.rendezvous = new InterventionRendezvous(telemetry, config.getInterventionTimeout());
        this.coordinator = new CancellationCoordinator();
        this.registry = new TaskRegistry();
        this.executor = Executors.newCachedThreadPool(taskThreadFactory());
    }

    /**
     * Admit and start a task. {@code acknowledge} runs after the admission decision and before
     * the task can emit anything, so the operator always sees the acknowledgement first.
     */
    public AdmissionResult<TaskRecord> submit(String taskKey, String prompt, String requestId,
                                              Consumer<AdmissionResult<TaskRecord>> acknowledge) {
        AdmissionResult<TaskRecord> admission =
            registry.admit(taskKey, requestId, prompt != null ? prompt : "", coordinator::register);
        if (acknowledge != null) {
            acknowledge.accept(admission);
        }
        if (admission.isDuplicate()) {
            return admission;
        }

        TaskRecord record = admission.getRecord();
        TaskContext context = new TaskContext(record, coordinator, telemetry, rendezvous);
        record.getToken().onCancel(() -> escalate(record));
        try {
            record.attachFuture(executor.submit(new TaskRunner(this, runtime, record, context)));
        } catch (RejectedExecutionException e) {
            logWarning("Task " + record.getTaskKey() + " rejected by executor: " + e.getMessage());
            record.markRunning();
            finishTask(record, TaskState.FAILED, "Relay is shutting down", false);
        }
        return admission;
    }

    public AdmissionResult<TaskRecord> submit(String taskKey, String prompt, String requestId) {
        return submit(taskKey, prompt, requestId, null);
    }

    /**
     * Cancel the live task for {@code taskKey}. When none is found (it may have just finished)
     * the configured fallback cancels every live task instead.
     */
    public CancelOutcome cancel(String taskKey) {
        String key = TaskRegistry.normalizeKey(taskKey);
        if (registry.findLive(key).isPresent() && coordinator.requestCancel(key)) {
            return CancelOutcome.TARGETED;
        }
        if (!config.isKillFallbackToAll() || !registry.hasLiveTasks()) {
            log("Kill for task " + key + " found no live task");
            return CancelOutcome.NOT_FOUND;
        }
        logWarning("Kill for task " + key + " found no live task; cancelling all live tasks");
        coordinator.requestCancelAll();
        coordinator.clearCancelAllIfIdle(registry.hasLiveTasks());
        return CancelOutcome.FALLBACK_ALL;
    }

    /**
     * Cancel every live task.
     *
     * @return number of tasks signalled
     */
    public int cancelAll() {
        int signalled = coordinator.requestCancelAll();
        coordinator.clearCancelAllIfIdle(registry.hasLiveTasks());
        return signalled;
    }

    public boolean completeIntervention(String interventionId, String payload) {
        return rendezvous.complete(interventionId, payload);
    }

    /**
     * Stop a task's collaborators after its token fires. The agent is flagged inline so its own
     * loop exits; aborting the page operation, stopping the agent and interrupting the worker run
     * on the task pool because the cancelling thread may be a socket thread.
     */
    void escalate(TaskRecord record) {
        AutomationAgent agent = record.getAgent();
        if (agent != null) {
            agent.state().markStopped();
            agent.state().exhaustRetries(config.getAgentMaxFailures());
        }
        try {
            executor.execute(() -> stopCollaborators(record));
        } catch (RejectedExecutionException e) {
            stopCollaborators(record);
        }
    }

    private void stopCollaborators(TaskRecord record) {
        String key = record.getTaskKey();
        BrowserSession session = record.getSession();
        if (session != null) {
            try {
                session.abortCurrentOperation();
            } catch (RuntimeException e) {
                logWarning("Abort of page operation for task " + key + " failed: " + e.getMessage());
            }
        }

        AutomationAgent agent = record.getAgent();
        if (agent != null) {
            try {
                agent.stop();
            } catch (RuntimeException e) {
                logWarning("Stopping agent for task " + key + " failed: " + e.getMessage());
            }
        }

        if (record.interruptIfRunning()) {
            log("Interrupted worker for task " + key);
        }
    }

    /**
     * Finalize a task exactly once: report the outcome, clear its cancellation state, and
     * remove it from the registry.
     */
    void finishTask(TaskRecord record, TaskState terminal, String content, boolean success) {
        if (!record.finish(terminal)) {
            return;
        }
        // An interrupt delivered before finish() must not break the sends below
        Thread.interrupted();

        String key = record.getTaskKey();
        switch (terminal) {
            case CANCELLED:
                telemetry.toolCall(key, "browser_agent_cancelled", "Task was cancelled by user",
                    ToolCallStatus.CANCELLED);
                telemetry.result(key, content, false);
                break;
            case FAILED:
                telemetry.toolCall(key, "browser_agent_error", "Error: " + content, ToolCallStatus.FAILED);
                telemetry.result(key, content, false);
                break;
            default:
                telemetry.result(key, content, success);
                break;
        }

        coordinator.taskFinished(key, record.getToken(), registry.hasLiveTasksOtherThan(record));
        registry.complete(key, record);
        record.markDeregistered();
        log("Task " + key + " finished as " + terminal.wireName());
    }

    /**
     * Cancel everything, wake intervention waiters and stop the worker pool.
     */
    public void shutdown(Duration grace) {
        log("Shutting down orchestrator");
        coordinator.requestCancelAll();
        rendezvous.cancelAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                logWarning("Workers still running after " + grace.toMillis() + " ms; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        connection.closeCurrent();
    }

    /**
     * Snapshot for the status endpoint.
     */
    public Map<String, Object> status() {
        List<Map<String, Object>> tasks = new ArrayList<>();
        for (TaskRecord record : registry.liveRecords()) {
            Map<String, Object> task = new LinkedHashMap<>();
            task.put("tab_id", record.getTaskKey());
            task.put("request_id", record.getRequestId());
            task.put("state", record.getState().wireName());
            task.put("admitted_at", record.getAdmittedAt().toString());
            tasks.add(task);
        }
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("connected", connection.isConnected());
        status.put("runtime", runtime.name());
        status.put("tasks", tasks);
        status.put("pending_interventions", rendezvous.pendingCount());
        status.put("cancel_all", coordinator.isCancelAllRequested());
        return status;
    }

    public Optional<TaskRecord> findTask(String taskKey) {
        return registry.find(taskKey);
    }

    public ConnectionHandle connection() {
        return connection;
    }

    public TelemetryEmitter telemetry() {
        return telemetry;
    }

    public InterventionRendezvous interventions() {
        return rendezvous;
    }

    public CancellationCoordinator cancellation() {
        return coordinator;
    }

    public TaskRegistry registry() {
        return registry;
    }

    private ThreadFactory taskThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "agent-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[Orchestrator] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[Orchestrator] " + message);
        }
    }
}
