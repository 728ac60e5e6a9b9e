package com.agentrelay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentrelay.controllers.AgentSocketController;
import com.agentrelay.controllers.Controller;
import com.agentrelay.controllers.StatusController;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Binds, restarts and stops the Javalin server that carries the controller channel.
 * Restart and end-of-connection requests arrive on socket threads and are carried out on a
 * dedicated control thread.
 */
public class ServerLifecycle implements MessageDispatcher.ServerControl {

    private static final Duration WORKER_GRACE = Duration.ofSeconds(5);

    private final AppConfig config;
    private final ObjectMapper objectMapper;
    private final AgentOrchestrator orchestrator;
    private final PortReclaimer reclaimer;
    private final List<Controller> controllers;
    private final ExecutorService control;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AppLogger logger = AppLogger.get();

    private volatile Javalin app;
    private volatile int exitCode = 0;

    public ServerLifecycle(AppConfig config, ObjectMapper objectMapper, AgentOrchestrator orchestrator,
                           PortReclaimer reclaimer) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.orchestrator = orchestrator;
        this.reclaimer = reclaimer;
        MessageDispatcher dispatcher = new MessageDispatcher(orchestrator, objectMapper, this);
        this.controllers = List.of(
            new AgentSocketController(orchestrator, dispatcher),
            new StatusController(orchestrator)
        );
        this.control = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "server-control");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Bind the configured port, reclaiming it first when {@code reclaim} is set.
     *
     * @throws PortBindExhaustedException if every bind attempt failed
     */
    public synchronized void start(boolean reclaim) throws PortBindExhaustedException {
        if (reclaim) {
            PortReclaimer.ReclaimResult result = reclaimer.ensureAvailable(config.getHost(), config.getPort());
            log("Port " + config.getPort() + " reclaim: " + result);
        }
        app = reclaimer.bindWithRetry(config.getPort(), this::createAndStart);
        log("Relay listening on ws://" + config.getHost() + ":" + app.port() + AgentSocketController.PATH);
    }

    private Javalin createAndStart() {
        Javalin candidate = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.showJavalinBanner = false;
            cfg.jetty.wsFactoryConfig(factory -> factory.setIdleTimeout(config.getSocketIdleTimeout()));
        });
        for (Controller controller : controllers) {
            controller.registerRoutes(candidate);
        }
        candidate.exception(Exception.class, (e, ctx) -> {
            if (logger != null) {
                logger.error("Unhandled exception: " + e.getMessage(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        });
        try {
            candidate.start(config.getHost(), config.getPort());
        } catch (RuntimeException e) {
            candidate.stop();
            throw e;
        }
        return candidate;
    }

    /**
     * The bound port, which differs from the configured one when that was 0.
     */
    public int port() {
        Javalin current = app;
        return current != null ? current.port() : -1;
    }

    @Override
    public void endConnection() {
        control.execute(() -> {
            orchestrator.connection().closeCurrent();
            stop();
        });
    }

    @Override
    public void restartServer() {
        control.execute(() -> {
            log("Restarting server on port " + config.getPort());
            synchronized (this) {
                stopServer();
                try {
                    start(true);
                } catch (PortBindExhaustedException e) {
                    if (logger != null) {
                        logger.error("Restart failed: " + e.getMessage(), e);
                    }
                    exitCode = 1;
                    stop();
                }
            }
        });
    }

    /**
     * Stop the server and the orchestrator. Idempotent.
     */
    public void stop() {
        synchronized (this) {
            if (stopped.getCount() == 0) {
                return;
            }
            orchestrator.shutdown(WORKER_GRACE);
            stopServer();
            stopped.countDown();
        }
        control.shutdown();
        log("Relay stopped");
    }

    public void awaitStopped() throws InterruptedException {
        stopped.await();
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    public int exitCode() {
        return exitCode;
    }

    private void stopServer() {
        Javalin current = app;
        app = null;
        if (current != null) {
            current.stop();
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[Server] " + message);
        }
    }
}
