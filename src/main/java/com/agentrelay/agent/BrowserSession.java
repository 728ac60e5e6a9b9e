package com.agentrelay.agent;

/**
 * A browser-driving session opened for one task.
 */
public interface BrowserSession {

    void start() throws Exception;

    void close() throws Exception;

    /**
     * Abort whatever page operation is in flight (navigation, evaluation). Safe to call from
     * another thread and when nothing is in flight.
     */
    void abortCurrentOperation();
}
