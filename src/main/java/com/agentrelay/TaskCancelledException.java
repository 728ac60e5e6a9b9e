package com.agentrelay;

/**
 * Raised at a checkpoint once cancellation has been requested for the running task.
 */
public class TaskCancelledException extends RuntimeException {

    private final String taskKey;

    public TaskCancelledException(String taskKey) {
        super("Task was cancelled by user");
        this.taskKey = taskKey;
    }

    public String getTaskKey() {
        return taskKey;
    }
}
