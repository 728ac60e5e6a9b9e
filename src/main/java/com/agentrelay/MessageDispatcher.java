package com.agentrelay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentrelay.models.Acknowledgement;
import com.agentrelay.models.AdmissionResult;

import java.util.UUID;

/**
 * Routes inbound controller frames.
 *
 * <pre>
 *   browser_agent_request        admit and start a task for tab_id
 *   kill_agent                   cancel tab_id, or every task when tab_id is absent
 *   human_intervention_complete  release the waiting task
 *   end_connection               close the channel and stop the relay
 *   restart_server               rebind the listening port
 *   regular_chat                 start a task for the default key
 *   anything else                the raw frame becomes the prompt of a default-key task
 * </pre>
 */
public class MessageDispatcher {

    public static final String TYPE_AGENT_REQUEST = "browser_agent_request";
    public static final String TYPE_KILL = "kill_agent";
    public static final String TYPE_INTERVENTION_COMPLETE = "human_intervention_complete";
    public static final String TYPE_END_CONNECTION = "end_connection";
    public static final String TYPE_RESTART = "restart_server";
    public static final String TYPE_REGULAR_CHAT = "regular_chat";

    /**
     * Server-level actions requested over the channel. Implementations must not block the
     * calling socket thread.
     */
    public interface ServerControl {
        void endConnection();

        void restartServer();
    }

    private final AgentOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final ServerControl serverControl;
    private final AppLogger logger = AppLogger.get();

    public MessageDispatcher(AgentOrchestrator orchestrator, ObjectMapper objectMapper, ServerControl serverControl) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.serverControl = serverControl;
    }

    /**
     * Handle one frame. Never throws: failures are answered with an error acknowledgement.
     */
    public void dispatch(DuplexChannel source, String frame) {
        try {
            route(source, frame);
        } catch (Exception e) {
            logError("Error processing message", e);
            reply(source, new Acknowledgement(Acknowledgement.ERROR,
                "Server error processing message: " + TaskRunner.describe(e)));
        }
    }

    private void route(DuplexChannel source, String frame) {
        JsonNode data;
        try {
            data = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log("Received non-JSON message, treating as task");
            startTask(source, TaskRegistry.DEFAULT_TASK_KEY, frame, null, "Task started");
            return;
        }
        if (data == null || !data.isObject()) {
            startTask(source, TaskRegistry.DEFAULT_TASK_KEY, frame, null, "Task started");
            return;
        }

        String type = data.path("type").asText("");
        switch (type) {
            case TYPE_INTERVENTION_COMPLETE:
                completeIntervention(source, data);
                break;
            case TYPE_END_CONNECTION:
                log("Received end_connection request");
                reply(source, new Acknowledgement(Acknowledgement.OK, "Ending connection"));
                serverControl.endConnection();
                break;
            case TYPE_RESTART:
                log("Received restart_server request");
                reply(source, new Acknowledgement(Acknowledgement.OK, "Server restarting"));
                serverControl.restartServer();
                break;
            case TYPE_KILL:
                kill(source, data);
                break;
            case TYPE_AGENT_REQUEST:
                String requestId = data.path("id").asText(null);
                startTask(source,
                    TaskRegistry.normalizeKey(data.path("tab_id").asText(null)),
                    data.path("prompt").asText(""),
                    requestId != null ? requestId : UUID.randomUUID().toString(),
                    "Browser agent task started");
                break;
            case TYPE_REGULAR_CHAT:
                JsonNode chat = data.path("regular_chat");
                startTask(source, TaskRegistry.DEFAULT_TASK_KEY,
                    chat.isTextual() ? chat.asText() : frame, null, "Task started");
                break;
            default:
                log("Unknown message type '" + type + "', treating as task");
                startTask(source, TaskRegistry.DEFAULT_TASK_KEY, frame, null, "Task started");
                break;
        }
    }

    private void startTask(DuplexChannel source, String taskKey, String prompt, String requestId,
                           String startedMessage) {
        String id = requestId != null ? requestId : UUID.randomUUID().toString();
        orchestrator.submit(taskKey, prompt, id, admission -> acknowledge(source, admission, startedMessage, id));
    }

    private void acknowledge(DuplexChannel source, AdmissionResult<TaskRecord> admission, String startedMessage,
                             String requestId) {
        TaskRecord record = admission.getRecord();
        if (admission.isAccepted()) {
            reply(source, new Acknowledgement(Acknowledgement.PROCESSING, startedMessage,
                record.getTaskKey(), record.getRequestId()));
        } else {
            reply(source, new Acknowledgement(Acknowledgement.DUPLICATE,
                "Browser agent already processing task for tab " + record.getTaskKey(),
                record.getTaskKey(), requestId));
        }
    }

    private void kill(DuplexChannel source, JsonNode data) {
        JsonNode tabId = data.get("tab_id");
        if (tabId == null || tabId.isNull() || tabId.asText().isBlank()) {
            int signalled = orchestrator.cancelAll();
            reply(source, new Acknowledgement(Acknowledgement.OK,
                "Cancellation requested for all tasks (" + signalled + " running)"));
            return;
        }

        String key = tabId.asText();
        AgentOrchestrator.CancelOutcome outcome = orchestrator.cancel(key);
        String message;
        switch (outcome) {
            case TARGETED:
                message = "Cancellation requested for tab " + key;
                break;
            case FALLBACK_ALL:
                message = "No running task for tab " + key + "; cancellation requested for all tasks";
                break;
            default:
                message = "No running task for tab " + key;
                break;
        }
        reply(source, new Acknowledgement(Acknowledgement.OK, message, key, null));
    }

    private void completeIntervention(DuplexChannel source, JsonNode data) {
        String interventionId = data.path("intervention_id").asText(null);
        JsonNode response = data.path("response");
        String payload = response.isMissingNode() || response.isNull()
            ? null
            : (response.isTextual() ? response.asText() : response.toString());

        if (orchestrator.completeIntervention(interventionId, payload)) {
            log("Intervention " + interventionId + " completed");
            reply(source, new Acknowledgement(Acknowledgement.OK, "Intervention completed"));
        }
        // Unknown ids are only logged by the rendezvous; the sender gets no error
    }

    private void reply(DuplexChannel source, Acknowledgement ack) {
        try {
            orchestrator.connection().sendTo(source, objectMapper.writeValueAsString(ack));
        } catch (JsonProcessingException e) {
            logError("Could not serialize acknowledgement", e);
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[Dispatcher] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        if (logger != null) {
            logger.error("[Dispatcher] " + message + ": " + TaskRunner.describe(t), t);
        }
    }
}
