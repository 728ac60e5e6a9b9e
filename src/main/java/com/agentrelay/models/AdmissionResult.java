package com.agentrelay.models;

/**
 * Outcome of asking the task registry to admit a run request. A duplicate is an expected
 * answer for a key that already has a live task, not an error.
 */
public final class AdmissionResult<R> {

    private final boolean accepted;
    private final R record;

    private AdmissionResult(boolean accepted, R record) {
        this.accepted = accepted;
        this.record = record;
    }

    public static <R> AdmissionResult<R> accepted(R record) {
        return new AdmissionResult<>(true, record);
    }

    public static <R> AdmissionResult<R> duplicate(R existing) {
        return new AdmissionResult<>(false, existing);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public boolean isDuplicate() {
        return !accepted;
    }

    /**
     * The new record when accepted, the live record that blocked admission otherwise.
     */
    public R getRecord() {
        return record;
    }
}
