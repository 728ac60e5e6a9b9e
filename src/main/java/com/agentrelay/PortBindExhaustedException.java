package com.agentrelay;

/**
 * The listening port could not be bound after every retry. Fatal at startup.
 */
public class PortBindExhaustedException extends Exception {

    private final int port;
    private final int attempts;

    public PortBindExhaustedException(int port, int attempts, Throwable cause) {
        super("Could not bind port " + port + " after " + attempts + " attempt(s)", cause);
        this.port = port;
        this.attempts = attempts;
    }

    public int getPort() {
        return port;
    }

    public int getAttempts() {
        return attempts;
    }
}
