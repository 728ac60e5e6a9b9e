package com.agentrelay;

import com.agentrelay.agent.AgentContext;
import com.agentrelay.models.InterventionOutcome;
import com.agentrelay.models.ToolCallStatus;

/**
 * The relay side of {@link AgentContext} for one admitted task.
 */
class TaskContext implements AgentContext {

    private final TaskRecord record;
    private final CancellationCoordinator coordinator;
    private final TelemetryEmitter telemetry;
    private final InterventionRendezvous rendezvous;

    TaskContext(TaskRecord record, CancellationCoordinator coordinator,
                TelemetryEmitter telemetry, InterventionRendezvous rendezvous) {
        this.record = record;
        this.coordinator = coordinator;
        this.telemetry = telemetry;
        this.rendezvous = rendezvous;
    }

    @Override
    public String taskKey() {
        return record.getTaskKey();
    }

    @Override
    public String prompt() {
        return record.getPrompt();
    }

    @Override
    public void checkpoint() {
        record.getToken().throwIfCancelled();
        coordinator.checkpoint(record.getTaskKey());
    }

    @Override
    public boolean isCancelled() {
        return record.getToken().isCancelled() || coordinator.isCancelRequested(record.getTaskKey());
    }

    @Override
    public void reportToolCall(String name, String details, ToolCallStatus status) {
        checkpoint();
        telemetry.toolCall(record.getTaskKey(), name, details, status);
    }

    @Override
    public InterventionOutcome requestHumanIntervention(String reason) {
        checkpoint();
        return rendezvous.request(record.getTaskKey(), reason, record.getToken());
    }
}
