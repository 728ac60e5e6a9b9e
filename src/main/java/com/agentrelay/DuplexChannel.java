package com.agentrelay;

import java.io.IOException;

/**
 * One side of the controller link. Implementations wrap a WebSocket session.
 */
public interface DuplexChannel {

    String id();

    void send(String frame) throws IOException;

    boolean isOpen();

    void close();
}
