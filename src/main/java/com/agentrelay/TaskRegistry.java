package com.agentrelay;

import com.agentrelay.models.AdmissionResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tracks at most one live unit of work per task key.
 */
public class TaskRegistry {

    /** Task key used when a request does not name one. */
    public static final String DEFAULT_TASK_KEY = "current";

    private final Map<String, TaskRecord> records = new HashMap<>();
    private final AppLogger logger = AppLogger.get();

    /**
     * Atomically admit a new unit of work for {@code taskKey}. The token factory is only called
     * when the request is accepted, inside the same critical section as the insert.
     */
    public AdmissionResult<TaskRecord> admit(String taskKey, String requestId, String prompt,
                                             Function<String, CancellationToken> tokenFactory) {
        String key = normalizeKey(taskKey);
        TaskRecord record;
        synchronized (records) {
            TaskRecord existing = records.get(key);
            if (existing != null && !existing.isTerminal()) {
                log("Rejected duplicate request " + requestId + " for task " + key
                    + " (live: " + existing.getRequestId() + ")");
                return AdmissionResult.duplicate(existing);
            }
            record = new TaskRecord(key, requestId, prompt, tokenFactory.apply(key));
            records.put(key, record);
        }
        log("Admitted request " + requestId + " for task " + key);
        return AdmissionResult.accepted(record);
    }

    /**
     * Remove the entry for {@code taskKey} only if it is still {@code record}; a stale
     * completion never deletes a newer task's entry.
     */
    public boolean complete(String taskKey, TaskRecord record) {
        boolean removed;
        synchronized (records) {
            removed = records.remove(normalizeKey(taskKey), record);
        }
        if (removed) {
            log("Task " + taskKey + " (" + record.getRequestId() + ") deregistered as " + record.getState());
        }
        return removed;
    }

    public Optional<TaskRecord> find(String taskKey) {
        synchronized (records) {
            return Optional.ofNullable(records.get(normalizeKey(taskKey)));
        }
    }

    /**
     * The live (non-terminal) record for {@code taskKey}, if any.
     */
    public Optional<TaskRecord> findLive(String taskKey) {
        return find(taskKey).filter(r -> !r.isTerminal());
    }

    public List<TaskRecord> liveRecords() {
        List<TaskRecord> live = new ArrayList<>();
        synchronized (records) {
            for (TaskRecord record : records.values()) {
                if (!record.isTerminal()) {
                    live.add(record);
                }
            }
        }
        return live;
    }

    public boolean hasLiveTasks() {
        return !liveRecords().isEmpty();
    }

    public boolean hasLiveTasksOtherThan(TaskRecord record) {
        synchronized (records) {
            for (TaskRecord candidate : records.values()) {
                if (candidate != record && !candidate.isTerminal()) {
                    return true;
                }
            }
        }
        return false;
    }

    public int size() {
        synchronized (records) {
            return records.size();
        }
    }

    public static String normalizeKey(String taskKey) {
        return taskKey == null || taskKey.isBlank() ? DEFAULT_TASK_KEY : taskKey;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[TaskRegistry] " + message);
        }
    }
}
