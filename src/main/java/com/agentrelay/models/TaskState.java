package com.agentrelay.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one unit of work: PENDING, then RUNNING, then exactly one terminal state.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
