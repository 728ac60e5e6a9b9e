package com.agentrelay;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single live controller channel. A new connection replaces the old one;
 * a close only clears the handle when the closing channel is still the current one.
 */
public class ConnectionHandle {

    private final AtomicReference<DuplexChannel> current = new AtomicReference<>();
    private final AppLogger logger = AppLogger.get();

    public void attach(DuplexChannel channel) {
        DuplexChannel previous = current.getAndSet(channel);
        if (previous != null && previous != channel) {
            log("Controller connection " + previous.id() + " replaced by " + channel.id());
        } else {
            log("Controller connection established: " + channel.id());
        }
    }

    public boolean detach(DuplexChannel channel) {
        boolean cleared = current.compareAndSet(channel, null);
        if (cleared) {
            log("Controller connection closed: " + channel.id());
        }
        return cleared;
    }

    public Optional<DuplexChannel> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isConnected() {
        DuplexChannel channel = current.get();
        return channel != null && channel.isOpen();
    }

    /**
     * Best-effort send on the current channel.
     *
     * @return false when there is no channel or the send failed
     */
    public boolean send(String frame) {
        DuplexChannel channel = current.get();
        if (channel == null) {
            return false;
        }
        return sendTo(channel, frame);
    }

    /**
     * Sends on a specific channel. Frames for one channel are written one at a time.
     */
    public boolean sendTo(DuplexChannel channel, String frame) {
        synchronized (channel) {
            try {
                channel.send(frame);
                return true;
            } catch (IOException | RuntimeException e) {
                logWarning("Send on " + channel.id() + " failed: " + e.getMessage());
                return false;
            }
        }
    }

    /**
     * Close and forget the current channel.
     */
    public void closeCurrent() {
        DuplexChannel channel = current.getAndSet(null);
        if (channel != null) {
            channel.close();
            log("Controller connection " + channel.id() + " closed by relay");
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[Connection] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[Connection] " + message);
        }
    }
}
