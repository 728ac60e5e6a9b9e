package com.agentrelay.controllers;

import com.agentrelay.AgentOrchestrator;
import com.agentrelay.AppLogger;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Read-only view of the relay for supervisors and health checks.
 *
 * Endpoints:
 *   GET /api/status   connection, live tasks, pending interventions, global cancel flag
 */
public class StatusController implements Controller {

    private final AgentOrchestrator orchestrator;
    private final AppLogger logger = AppLogger.get();

    public StatusController(AgentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/status", this::getStatus);
    }

    private void getStatus(Context ctx) {
        try {
            ctx.json(orchestrator.status());
        } catch (Exception e) {
            if (logger != null) {
                logger.warn("Failed to build status: " + e.getMessage());
            }
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
