package com.agentrelay;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Makes the relay's listening port available before the server binds it.
 *
 * <p>A supervisor may relaunch the relay while a previous instance is still shutting down or
 * has crashed and left the socket behind. The reclaimer first asks whatever listens on the port
 * to end its connection, then terminates the owning process, re-checking after each step.
 * Binding is retried a fixed number of times with a fixed backoff.</p>
 */
public class PortReclaimer {

    public enum ReclaimResult {
        ALREADY_FREE,
        RELEASED_GRACEFULLY,
        OWNER_TERMINATED,
        STILL_BUSY
    }

    /** Checks whether something is listening on a port. */
    @FunctionalInterface
    public interface PortProbe {
        boolean isBound(String host, int port);
    }

    /** Sends the graceful shutdown request to the current listener. */
    @FunctionalInterface
    public interface ShutdownRequester {
        boolean requestShutdown(String host, int port);
    }

    /** Finds and terminates the processes listening on a port. */
    public interface PortOwners {
        List<Long> findOwners(int port) throws IOException;

        boolean terminate(long pid);
    }

    /** One bind attempt; thrown exceptions count as a failed attempt. */
    @FunctionalInterface
    public interface BindAttempt<T> {
        T bind() throws Exception;
    }

    static final String END_CONNECTION_FRAME = "{\"type\":\"end_connection\"}";

    private final PortProbe probe;
    private final ShutdownRequester requester;
    private final PortOwners owners;
    private final Duration gracePeriod;
    private final int bindAttempts;
    private final Duration bindBackoff;
    private final Set<Long> terminatedPids = ConcurrentHashMap.newKeySet();
    private final AppLogger logger = AppLogger.get();

    public PortReclaimer(AppConfig config) {
        this(PortReclaimer::isPortBound,
            new WebSocketShutdownRequester(config.getReclaimGracePeriod()),
            new SystemPortOwners(config.getReclaimGracePeriod()),
            config.getReclaimGracePeriod(),
            config.getBindAttempts(),
            config.getBindBackoff());
    }

    PortReclaimer(PortProbe probe, ShutdownRequester requester, PortOwners owners,
                  Duration gracePeriod, int bindAttempts, Duration bindBackoff) {
        this.probe = probe;
        this.requester = requester;
        this.owners = owners;
        this.gracePeriod = gracePeriod;
        this.bindAttempts = Math.max(1, bindAttempts);
        this.bindBackoff = bindBackoff;
    }

    /**
     * Free {@code port} if something holds it. A no-op on a free port; a repeated call never
     * terminates the same process twice.
     */
    public ReclaimResult ensureAvailable(String host, int port) {
        if (!probe.isBound(host, port)) {
            return ReclaimResult.ALREADY_FREE;
        }
        log("Port " + port + " is in use; asking the current listener to shut down");

        if (requester.requestShutdown(host, port)) {
            pause(gracePeriod);
            if (!probe.isBound(host, port)) {
                log("Port " + port + " released gracefully");
                return ReclaimResult.RELEASED_GRACEFULLY;
            }
        }

        List<Long> pids;
        try {
            pids = owners.findOwners(port);
        } catch (IOException e) {
            logWarning("Could not determine the owner of port " + port + ": " + e.getMessage());
            pids = List.of();
        }

        long self = ProcessHandle.current().pid();
        boolean terminatedAny = false;
        for (Long pid : pids) {
            if (pid == null || pid == self) {
                continue;
            }
            if (!terminatedPids.add(pid)) {
                log("Process " + pid + " was already terminated; not signalling it again");
                continue;
            }
            if (owners.terminate(pid)) {
                log("Terminated process " + pid + " holding port " + port);
                terminatedAny = true;
            } else {
                logWarning("Failed to terminate process " + pid + " holding port " + port);
            }
        }

        if (terminatedAny) {
            pause(gracePeriod);
        }
        if (!probe.isBound(host, port)) {
            return terminatedAny ? ReclaimResult.OWNER_TERMINATED : ReclaimResult.RELEASED_GRACEFULLY;
        }
        logWarning("Port " + port + " is still in use after reclaiming");
        return ReclaimResult.STILL_BUSY;
    }

    /**
     * Run {@code attempt} until it succeeds or the attempts are used up.
     *
     * @throws PortBindExhaustedException after the last failed attempt
     */
    public <T> T bindWithRetry(int port, BindAttempt<T> attempt) throws PortBindExhaustedException {
        Exception last = null;
        for (int i = 1; i <= bindAttempts; i++) {
            try {
                return attempt.bind();
            } catch (Exception e) {
                last = e;
                logWarning("Bind attempt " + i + "/" + bindAttempts + " on port " + port + " failed: "
                    + e.getMessage());
            }
            if (i < bindAttempts && !pause(bindBackoff)) {
                break;
            }
        }
        throw new PortBindExhaustedException(port, bindAttempts, last);
    }

    /**
     * True when a server socket cannot be bound on {@code host:port}.
     */
    public static boolean isPortBound(String host, int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(host, port));
            return false;
        } catch (IOException e) {
            return true;
        }
    }

    private static boolean pause(Duration duration) {
        if (duration.isZero()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[PortReclaimer] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[PortReclaimer] " + message);
        }
    }

    /**
     * Connects as a WebSocket client and sends {@code end_connection}.
     */
    static class WebSocketShutdownRequester implements ShutdownRequester {

        private final Duration timeout;
        private final AppLogger logger = AppLogger.get();

        WebSocketShutdownRequester(Duration timeout) {
            this.timeout = timeout.isZero() ? Duration.ofSeconds(1) : timeout;
        }

        @Override
        public boolean requestShutdown(String host, int port) {
            HttpClient client = HttpClient.newBuilder().connectTimeout(timeout).build();
            try {
                WebSocket socket = client.newWebSocketBuilder()
                    .connectTimeout(timeout)
                    .buildAsync(URI.create("ws://" + host + ":" + port + "/"), new WebSocket.Listener() {
                        @Override
                        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                            webSocket.request(1);
                            return null;
                        }
                    })
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                socket.sendText(END_CONNECTION_FRAME, true).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "").get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (Exception e) {
                if (logger != null) {
                    logger.warn("[PortReclaimer] Graceful shutdown request to port " + port + " failed: "
                        + e.getMessage());
                }
                return false;
            }
        }
    }
}
