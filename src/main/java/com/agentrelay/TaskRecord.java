package com.agentrelay;

import com.agentrelay.agent.AutomationAgent;
import com.agentrelay.agent.BrowserSession;
import com.agentrelay.models.TaskState;

import java.lang.ref.WeakReference;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One admitted unit of work. Created by {@link TaskRegistry#admit}, finalized exactly once
 * through {@link #finish}.
 */
public class TaskRecord {

    private final String taskKey;
    private final String requestId;
    private final String prompt;
    private final CancellationToken token;
    private final Instant admittedAt = Instant.now();
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);
    private final CompletableFuture<TaskState> completion = new CompletableFuture<>();

    private volatile Future<?> future;
    private volatile WeakReference<AutomationAgent> agentRef = new WeakReference<>(null);
    private volatile BrowserSession session;

    TaskRecord(String taskKey, String requestId, String prompt, CancellationToken token) {
        this.taskKey = taskKey;
        this.requestId = requestId;
        this.prompt = prompt;
        this.token = token;
    }

    public String getTaskKey() {
        return taskKey;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getPrompt() {
        return prompt;
    }

    public CancellationToken getToken() {
        return token;
    }

    public Instant getAdmittedAt() {
        return admittedAt;
    }

    public TaskState getState() {
        return state.get();
    }

    public boolean isTerminal() {
        return state.get().isTerminal();
    }

    /**
     * Resolves with the terminal state once the record has been finalized and deregistered.
     */
    public CompletableFuture<TaskState> completion() {
        return completion;
    }

    boolean markRunning() {
        return state.compareAndSet(TaskState.PENDING, TaskState.RUNNING);
    }

    /**
     * Move from RUNNING to a terminal state. Only the first caller wins.
     */
    synchronized boolean finish(TaskState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        return state.compareAndSet(TaskState.RUNNING, terminal);
    }

    /**
     * Interrupt the worker, but only while the task is still running; once {@link #finish}
     * has returned no interrupt can reach the finalizing worker.
     */
    synchronized boolean interruptIfRunning() {
        Future<?> current = future;
        if (state.get() != TaskState.RUNNING || current == null) {
            return false;
        }
        return current.cancel(true);
    }

    void markDeregistered() {
        completion.complete(state.get());
    }

    void attachFuture(Future<?> future) {
        this.future = future;
    }

    void attachSession(BrowserSession session) {
        this.session = session;
    }

    void attachAgent(AutomationAgent agent) {
        this.agentRef = new WeakReference<>(agent);
    }

    AutomationAgent getAgent() {
        return agentRef.get();
    }

    BrowserSession getSession() {
        return session;
    }

    @Override
    public String toString() {
        return "TaskRecord{" + taskKey + ", " + requestId + ", " + state.get() + "}";
    }
}
