package com.agentrelay.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immediate reply to an inbound frame.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Acknowledgement {

    public static final String PROCESSING = "processing";
    public static final String DUPLICATE = "duplicate";
    public static final String OK = "ok";
    public static final String ERROR = "error";

    private String status;
    private String message;
    @JsonProperty("tab_id")
    private String tabId;
    @JsonProperty("request_id")
    private String requestId;

    public Acknowledgement() {
    }

    public Acknowledgement(String status, String message) {
        this(status, message, null, null);
    }

    public Acknowledgement(String status, String message, String tabId, String requestId) {
        this.status = status;
        this.message = message;
        this.tabId = tabId;
        this.requestId = requestId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getTabId() {
        return tabId;
    }

    public void setTabId(String tabId) {
        this.tabId = tabId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }
}
