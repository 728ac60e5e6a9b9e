package com.agentrelay;

import com.agentrelay.models.InterventionOutcome;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pauses a running task until the operator answers an intervention request.
 *
 * <p>Each request gets a fresh id and record. The waiter resolves with exactly one of
 * success, cancelled, timeout or failed, and the record is removed on every path.</p>
 */
public class InterventionRendezvous {

    static final String DEFAULT_REASON = "Action requires human intervention";

    private final Map<String, InterventionRecord> pending = new ConcurrentHashMap<>();
    private final TelemetryEmitter telemetry;
    private final Duration timeout;
    private final AppLogger logger = AppLogger.get();

    public InterventionRendezvous(TelemetryEmitter telemetry, Duration timeout) {
        this.telemetry = telemetry;
        this.timeout = timeout;
    }

    /**
     * Ask the operator for a decision and block the calling task until it arrives.
     *
     * @param token the task's cancellation token; cancelling it ends the wait
     */
    public InterventionOutcome request(String taskKey, String reason, CancellationToken token) {
        String why = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
        InterventionRecord record = new InterventionRecord(UUID.randomUUID().toString(), taskKey, why);
        // Registered before the frame goes out so an immediate answer finds it
        pending.put(record.id, record);

        CancellationToken.Registration registration = token != null
            ? token.onCancel(() -> record.signal.cancel(false))
            : () -> { };
        try {
            if (record.signal.isCancelled()) {
                log("Task " + taskKey + " cancelled before intervention " + record.id + " was requested");
                return InterventionOutcome.cancelled(why);
            }
            if (!telemetry.interventionRequired(record.id, why)) {
                logWarning("Could not deliver intervention request " + record.id + " for task " + taskKey);
                return InterventionOutcome.failed("Failed to request intervention: no controller connection");
            }
            log("Waiting for intervention " + record.id + " (task " + taskKey + "): " + why);

            String payload = record.signal.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log("Intervention " + record.id + " completed");
            return InterventionOutcome.success(why, payload);
        } catch (CancellationException e) {
            log("Intervention " + record.id + " cancelled");
            return InterventionOutcome.cancelled(why);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log("Intervention " + record.id + " interrupted");
            return InterventionOutcome.cancelled(why);
        } catch (TimeoutException e) {
            logWarning("Timeout waiting for intervention " + record.id + ": " + why);
            return InterventionOutcome.timeout();
        } catch (ExecutionException e) {
            return InterventionOutcome.failed("Intervention failed: " + e.getCause().getMessage());
        } finally {
            registration.close();
            pending.remove(record.id, record);
        }
    }

    /**
     * Signal the waiter for {@code interventionId}.
     *
     * @return false for an unknown or already finished id; that is logged and otherwise ignored
     */
    public boolean complete(String interventionId, String payload) {
        InterventionRecord record = interventionId != null ? pending.get(interventionId) : null;
        if (record == null) {
            logWarning("Intervention id " + interventionId + " not found in active interventions");
            return false;
        }
        return record.signal.complete(payload);
    }

    /**
     * Wake every waiter with a cancellation, used on shutdown.
     */
    public int cancelAll() {
        int cancelled = 0;
        for (InterventionRecord record : pending.values()) {
            if (record.signal.cancel(false)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int pendingCount() {
        return pending.size();
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[Intervention] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[Intervention] " + message);
        }
    }

    private static final class InterventionRecord {
        private final String id;
        private final String taskKey;
        private final String reason;
        private final CompletableFuture<String> signal = new CompletableFuture<>();

        private InterventionRecord(String id, String taskKey, String reason) {
            this.id = id;
            this.taskKey = taskKey;
            this.reason = reason;
        }

        @Override
        public String toString() {
            return id + " (task " + taskKey + "): " + reason;
        }
    }
}
