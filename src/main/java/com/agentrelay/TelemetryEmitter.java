package com.agentrelay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.agentrelay.models.ToolCallStatus;

/**
 * Formats progress, result and intervention frames and sends them over the current
 * controller connection. Telemetry never fails the caller: without a connection every
 * method is a no-op and send errors are only logged.
 */
public class TelemetryEmitter {

    public static final String TYPE_TOOL_CALL = "browser_agent_tool_call";
    public static final String TYPE_RESPONSE = "browser_agent_response";
    public static final String TYPE_INTERVENTION_REQUIRED = "human_intervention_required";

    static final String DEFAULT_RESULT_CONTENT = "Task completed successfully";

    private final ConnectionHandle connection;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public TelemetryEmitter(ConnectionHandle connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    public boolean toolCall(String taskKey, String name, String details, ToolCallStatus status) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", TYPE_TOOL_CALL);
        frame.put("tab_id", taskKey != null ? taskKey : TaskRegistry.DEFAULT_TASK_KEY);
        ObjectNode toolCall = frame.putObject("tool_call");
        toolCall.put("name", name);
        toolCall.put("status", status.wireName());
        toolCall.put("details", formatDetails(name, details));
        frame.put("timestamp", timestamp());
        return send(frame, "tool call " + name);
    }

    public boolean result(String taskKey, String content, boolean success) {
        String text = content == null || content.isBlank() ? DEFAULT_RESULT_CONTENT : content;
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", TYPE_RESPONSE);
        frame.put("tab_id", taskKey != null ? taskKey : TaskRegistry.DEFAULT_TASK_KEY);
        ObjectNode result = frame.putObject("result");
        result.put("content", text);
        result.put("success", success);
        frame.put("timestamp", timestamp());
        return send(frame, "result for " + taskKey);
    }

    public boolean interventionRequired(String interventionId, String reason) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", TYPE_INTERVENTION_REQUIRED);
        frame.put("intervention_id", interventionId);
        frame.put("reason", reason);
        frame.put("timestamp", timestamp());
        return send(frame, "intervention request " + interventionId);
    }

    /**
     * Rewrites raw action details into operator-facing text for the common actions.
     */
    static String formatDetails(String actionName, String details) {
        String raw = details != null ? details : "";
        String action = actionName != null ? actionName.toLowerCase() : "";

        if (action.contains("click")) {
            if (raw.contains("index")) {
                String[] parts = raw.split(":", 2);
                if (parts.length > 1 && !parts[1].isBlank()) {
                    return "Clicking element: " + parts[1].trim();
                }
                return "Clicking interface element";
            }
        } else if (action.contains("input_text")) {
            // Never echo what is being typed
            return "Typing text into form field";
        } else if (action.contains("search_google")) {
            if (raw.contains("Searched for") && raw.contains("\"")) {
                String[] quoted = raw.split("\"");
                if (quoted.length > 1 && !quoted[1].isEmpty()) {
                    return "Searching for: " + quoted[1];
                }
            }
        }
        return raw;
    }

    private boolean send(ObjectNode frame, String what) {
        if (connection.current().isEmpty()) {
            return false;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            logWarning("Could not serialize " + what + ": " + e.getMessage());
            return false;
        }
        return connection.send(json);
    }

    private static double timestamp() {
        return System.currentTimeMillis() / 1000.0;
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[Telemetry] " + message);
        }
    }
}
