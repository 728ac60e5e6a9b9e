package com.agentrelay.models;

/**
 * What a task observes after asking for human intervention. Exactly one outcome is produced
 * per request.
 */
public final class InterventionOutcome {

    public enum Status {
        SUCCESS,
        CANCELLED,
        TIMEOUT,
        FAILED
    }

    private final Status status;
    private final String message;
    private final String payload;

    private InterventionOutcome(Status status, String message, String payload) {
        this.status = status;
        this.message = message;
        this.payload = payload;
    }

    public static InterventionOutcome success(String reason, String payload) {
        return new InterventionOutcome(Status.SUCCESS, "Human intervention completed for: " + reason, payload);
    }

    public static InterventionOutcome cancelled(String reason) {
        return new InterventionOutcome(Status.CANCELLED, "Intervention wait cancelled: " + reason, null);
    }

    public static InterventionOutcome timeout() {
        return new InterventionOutcome(Status.TIMEOUT, "Timeout waiting for human intervention", null);
    }

    public static InterventionOutcome failed(String message) {
        return new InterventionOutcome(Status.FAILED, message, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Optional data sent back by the operator with the completion.
     */
    public String getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return status + ": " + message;
    }
}
