package com.agentrelay;

import com.agentrelay.models.AdmissionResult;
import com.agentrelay.models.InterventionOutcome;
import com.agentrelay.models.TaskState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentOrchestratorTest {

    private static final long WAIT_MS = 5000;

    @TempDir
    Path tempDir;

    private final RecordingChannel channel = new RecordingChannel("controller");
    private final ScriptedAgentRuntime runtime = new ScriptedAgentRuntime();
    private AgentOrchestrator orchestrator;

    private AgentOrchestrator start(boolean killFallback) throws Exception {
        AppConfig config = new AppConfig.Builder()
            .logPath(tempDir.resolve("relay.log"))
            .interventionTimeout(Duration.ofSeconds(10))
            .killFallbackToAll(killFallback)
            .build();
        orchestrator = new AgentOrchestrator(config, new ObjectMapper(), runtime);
        orchestrator.connection().attach(channel);
        return orchestrator;
    }

    @AfterEach
    void tearDown() {
        runtime.release();
        if (orchestrator != null) {
            orchestrator.shutdown(Duration.ofSeconds(2));
        }
    }

    private static TaskState awaitDone(TaskRecord record) throws Exception {
        return record.completion().get(WAIT_MS, TimeUnit.MILLISECONDS);
    }

    @Test
    void completedTaskReportsSingleResult() throws Exception {
        start(true);
        TaskRecord record = orchestrator.submit("tab-1", "open example.com", "r1").getRecord();
        assertTrue(runtime.awaitRunning(1, WAIT_MS));
        assertEquals(TaskState.RUNNING, record.getState());

        runtime.release();

        assertEquals(TaskState.COMPLETED, awaitDone(record));
        List<JsonNode> results = channel.framesMatching(RecordingChannel.response("tab-1"));
        assertEquals(1, results.size());
        assertTrue(results.get(0).path("result").path("success").asBoolean());
        assertEquals("Done: open example.com", results.get(0).path("result").path("content").asText());
        assertEquals(1, channel.framesMatching(RecordingChannel.toolCall("tab-1", "in_progress")).stream()
            .filter(f -> "browser_agent_start".equals(f.path("tool_call").path("name").asText())).count());
        assertEquals(0, orchestrator.registry().size());
        assertTrue(runtime.sessions().get(0).isClosed());
    }

    @Test
    void secondRequestForLiveKeyIsDuplicate() throws Exception {
        start(true);
        TaskRecord first = orchestrator.submit("tab-1", "a", "r1").getRecord();

        AdmissionResult<TaskRecord> second = orchestrator.submit("tab-1", "b", "r2");

        assertTrue(second.isDuplicate());
        assertSame(first, second.getRecord());
        runtime.release();
        awaitDone(first);
        assertEquals(1, runtime.agents().size());
    }

    @Test
    void acknowledgementRunsBeforeTaskStarts() throws Exception {
        start(true);
        StringBuilder order = new StringBuilder();

        orchestrator.submit("tab-1", "a", "r1", admission -> {
            order.append(runtime.agents().isEmpty() ? "ack" : "late-ack");
        });

        assertEquals("ack", order.toString());
    }

    @Test
    void killCancelsRunningTaskAndEscalates() throws Exception {
        start(true);
        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();
        assertTrue(runtime.awaitRunning(1, WAIT_MS));

        assertEquals(AgentOrchestrator.CancelOutcome.TARGETED, orchestrator.cancel("tab-1"));

        assertEquals(TaskState.CANCELLED, awaitDone(record));
        assertEquals(1, channel.framesMatching(RecordingChannel.toolCall("tab-1", "cancelled")).size());
        List<JsonNode> results = channel.framesMatching(RecordingChannel.response("tab-1"));
        assertEquals(1, results.size());
        assertFalse(results.get(0).path("result").path("success").asBoolean());
        assertEquals("Task was cancelled by user", results.get(0).path("result").path("content").asText());

        ScriptedAgentRuntime.TestAgent agent = runtime.agents().get(0);
        assertTrue(agent.state().isStopped());
        assertTrue(agent.state().getConsecutiveFailures() > 3);
        assertEquals(1, agent.stopCalls());
        assertEquals(1, runtime.sessions().get(0).aborts());
        assertTrue(runtime.sessions().get(0).isClosed());

        assertFalse(orchestrator.cancellation().hasPendingEntry("tab-1"));
        assertEquals(0, orchestrator.registry().size());
    }

    @Test
    void cancelledKeyAcceptsNewTask() throws Exception {
        start(true);
        TaskRecord first = orchestrator.submit("tab-1", "a", "r1").getRecord();
        assertTrue(runtime.awaitRunning(1, WAIT_MS));
        orchestrator.cancel("tab-1");
        awaitDone(first);

        runtime.release();
        TaskRecord second = orchestrator.submit("tab-1", "b", "r2").getRecord();

        assertEquals(TaskState.COMPLETED, awaitDone(second));
    }

    @Test
    void agentFailureReportsError() throws Exception {
        runtime.mode(ScriptedAgentRuntime.Mode.FAIL);
        start(true);

        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();

        assertEquals(TaskState.FAILED, awaitDone(record));
        List<JsonNode> errors = channel.framesMatching(RecordingChannel.toolCall("tab-1", "failed"));
        assertEquals(1, errors.size());
        assertEquals("browser_agent_error", errors.get(0).path("tool_call").path("name").asText());
        assertEquals("Error: page crashed", errors.get(0).path("tool_call").path("details").asText());
        JsonNode result = channel.await(RecordingChannel.response("tab-1"), WAIT_MS);
        assertFalse(result.path("result").path("success").asBoolean());
        assertEquals("page crashed", result.path("result").path("content").asText());
    }

    @Test
    void killForUnknownKeyFallsBackToAll() throws Exception {
        start(true);
        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();
        assertTrue(runtime.awaitRunning(1, WAIT_MS));

        assertEquals(AgentOrchestrator.CancelOutcome.FALLBACK_ALL, orchestrator.cancel("tab-gone"));

        assertEquals(TaskState.CANCELLED, awaitDone(record));
        assertFalse(orchestrator.cancellation().isCancelAllRequested());
    }

    @Test
    void fallbackKillRacingCompletionLeavesNoStaleCancelAll() throws Exception {
        start(true);
        orchestrator.connection().detach(channel);
        runtime.release();

        for (int i = 0; i < 300; i++) {
            TaskRecord record = orchestrator.submit("tab-1", "a", "r" + i).getRecord();
            orchestrator.cancel("tab-gone");
            awaitDone(record);
            assertFalse(orchestrator.cancellation().isCancelAllRequested(), "cancel-all left set in round " + i);
        }

        TaskRecord next = orchestrator.submit("tab-2", "b", "r-next").getRecord();
        assertEquals(TaskState.COMPLETED, awaitDone(next));
        assertFalse(next.getToken().isCancelled());
    }

    @Test
    void cancelReturnsWhileAgentStopIsBlocked() throws Exception {
        runtime.holdStop();
        start(true);
        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();
        assertTrue(runtime.awaitRunning(1, WAIT_MS));

        AgentOrchestrator.CancelOutcome outcome =
            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> orchestrator.cancel("tab-1"));

        assertEquals(AgentOrchestrator.CancelOutcome.TARGETED, outcome);
        ScriptedAgentRuntime.TestAgent agent = runtime.agents().get(0);
        assertTrue(agent.awaitStopEntered(WAIT_MS));
        assertTrue(agent.state().isStopped());
        assertEquals(TaskState.RUNNING, record.getState());

        runtime.releaseStop();

        assertEquals(TaskState.CANCELLED, awaitDone(record));
        assertEquals(1, runtime.sessions().get(0).aborts());
    }

    @Test
    void killForUnknownKeyWithoutFallbackLeavesOthersRunning() throws Exception {
        start(false);
        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();
        assertTrue(runtime.awaitRunning(1, WAIT_MS));

        assertEquals(AgentOrchestrator.CancelOutcome.NOT_FOUND, orchestrator.cancel("tab-gone"));

        assertFalse(record.getToken().isCancelled());
        runtime.release();
        assertEquals(TaskState.COMPLETED, awaitDone(record));
    }

    @Test
    void killWithNothingRunningIsNotFound() throws Exception {
        start(true);

        assertEquals(AgentOrchestrator.CancelOutcome.NOT_FOUND, orchestrator.cancel("tab-1"));
        assertFalse(orchestrator.cancellation().isCancelAllRequested());
    }

    @Test
    void cancelAllStopsEveryTaskThenClears() throws Exception {
        start(true);
        TaskRecord one = orchestrator.submit("tab-1", "a", "r1").getRecord();
        TaskRecord two = orchestrator.submit("tab-2", "b", "r2").getRecord();
        assertTrue(runtime.awaitRunning(2, WAIT_MS));

        assertEquals(2, orchestrator.cancelAll());

        assertEquals(TaskState.CANCELLED, awaitDone(one));
        assertEquals(TaskState.CANCELLED, awaitDone(two));
        assertFalse(orchestrator.cancellation().isCancelAllRequested());

        runtime.release();
        TaskRecord next = orchestrator.submit("tab-3", "c", "r3").getRecord();
        assertEquals(TaskState.COMPLETED, awaitDone(next));
    }

    @Test
    void cancelAllWithNothingRunningLeavesNoFlag() throws Exception {
        start(true);

        assertEquals(0, orchestrator.cancelAll());
        assertFalse(orchestrator.cancellation().isCancelAllRequested());
    }

    @Test
    void interventionCompletesTask() throws Exception {
        runtime.mode(ScriptedAgentRuntime.Mode.INTERVENE);
        start(true);
        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();

        JsonNode request = channel.await(RecordingChannel.ofType(TelemetryEmitter.TYPE_INTERVENTION_REQUIRED), WAIT_MS);
        assertNotNull(request);
        assertTrue(orchestrator.completeIntervention(request.path("intervention_id").asText(), "solved"));

        assertEquals(TaskState.COMPLETED, awaitDone(record));
        assertEquals("solved", runtime.lastIntervention().getPayload());
        JsonNode result = channel.await(RecordingChannel.response("tab-1"), WAIT_MS);
        assertEquals("Human intervention completed for: Solve the captcha",
            result.path("result").path("content").asText());
    }

    @Test
    void killDuringInterventionCancelsWait() throws Exception {
        runtime.mode(ScriptedAgentRuntime.Mode.INTERVENE);
        start(true);
        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();
        assertNotNull(channel.await(RecordingChannel.ofType(TelemetryEmitter.TYPE_INTERVENTION_REQUIRED), WAIT_MS));

        orchestrator.cancel("tab-1");

        assertEquals(TaskState.CANCELLED, awaitDone(record));
        assertEquals(InterventionOutcome.Status.CANCELLED, runtime.lastIntervention().getStatus());
        assertEquals(0, orchestrator.interventions().pendingCount());
    }

    @Test
    void statusListsLiveTasks() throws Exception {
        start(true);
        orchestrator.submit("tab-1", "a", "r1");
        assertTrue(runtime.awaitRunning(1, WAIT_MS));

        Map<String, Object> status = orchestrator.status();

        assertEquals(Boolean.TRUE, status.get("connected"));
        assertEquals("test", status.get("runtime"));
        List<?> tasks = (List<?>) status.get("tasks");
        assertEquals(1, tasks.size());
        Map<?, ?> task = (Map<?, ?>) tasks.get(0);
        assertEquals("tab-1", task.get("tab_id"));
        assertEquals("r1", task.get("request_id"));
        assertEquals("running", task.get("state"));
        assertEquals(0, status.get("pending_interventions"));
        assertEquals(Boolean.FALSE, status.get("cancel_all"));
    }

    @Test
    void submitAfterShutdownFails() throws Exception {
        start(true);
        orchestrator.shutdown(Duration.ofSeconds(1));
        RecordingChannel late = new RecordingChannel("late");
        orchestrator.connection().attach(late);

        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();

        assertEquals(TaskState.FAILED, awaitDone(record));
        JsonNode result = late.await(RecordingChannel.response("tab-1"), WAIT_MS);
        assertEquals("Relay is shutting down", result.path("result").path("content").asText());
    }

    @Test
    void resultsAreDroppedWithoutController() throws Exception {
        start(true);
        orchestrator.connection().detach(channel);
        TaskRecord record = orchestrator.submit("tab-1", "a", "r1").getRecord();
        assertTrue(runtime.awaitRunning(1, WAIT_MS));

        runtime.release();

        assertEquals(TaskState.COMPLETED, awaitDone(record));
        assertTrue(channel.frames().isEmpty());
    }
}
