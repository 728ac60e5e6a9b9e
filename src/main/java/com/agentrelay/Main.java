package com.agentrelay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentrelay.agent.AgentRuntime;
import com.agentrelay.agent.EchoAgentRuntime;

import java.util.Iterator;
import java.util.ServiceLoader;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        ServerLifecycle lifecycle;
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            AgentRuntime runtime = loadRuntime();
            logger.info("Agent runtime: " + runtime.name());

            AgentOrchestrator orchestrator = new AgentOrchestrator(config, objectMapper, runtime);
            lifecycle = new ServerLifecycle(config, objectMapper, orchestrator, new PortReclaimer(config));
            lifecycle.start(config.isRestartMode());

            logger.console("");
            logger.console("  Listening on ws://" + config.getHost() + ":" + lifecycle.port() + "/");
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            ServerLifecycle hooked = lifecycle;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                hooked.stop();
                logger.close();
            }, "shutdown-hook"));

        } catch (PortBindExhaustedException e) {
            report("Failed to bind port " + e.getPort() + " after " + e.getAttempts() + " attempt(s)", e);
            System.exit(1);
            return;
        } catch (Exception e) {
            report("Failed to start Agent Relay: " + e.getMessage(), e);
            System.exit(1);
            return;
        }

        try {
            lifecycle.awaitStopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Relay exited with code " + lifecycle.exitCode());
        System.exit(lifecycle.exitCode());
    }

    /**
     * First {@link AgentRuntime} registered through {@link ServiceLoader}, else the echo runtime.
     */
    static AgentRuntime loadRuntime() {
        Iterator<AgentRuntime> found = ServiceLoader.load(AgentRuntime.class).iterator();
        if (found.hasNext()) {
            return found.next();
        }
        return new EchoAgentRuntime();
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Agent Relay v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isRestartMode()) {
            logger.console("  Mode: Restart (reclaiming port " + config.getPort() + ")");
        }
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void report(String message, Exception e) {
        if (logger != null) {
            logger.error(message, e);
        }
        System.err.println(message);
        e.printStackTrace();
    }
}
