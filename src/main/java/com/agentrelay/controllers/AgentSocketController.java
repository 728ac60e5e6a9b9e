package com.agentrelay.controllers;

import com.agentrelay.AgentOrchestrator;
import com.agentrelay.AppLogger;
import com.agentrelay.DuplexChannel;
import com.agentrelay.MessageDispatcher;
import io.javalin.Javalin;
import org.eclipse.jetty.websocket.api.Session;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for the operator UI.
 *
 * Endpoint:
 *   WS  /    one JSON object per text frame, see {@link MessageDispatcher}
 *
 * The newest connection becomes the relay's controller channel; telemetry goes there.
 * Acknowledgements always go back on the channel that sent the frame.
 */
public class AgentSocketController implements Controller {

    public static final String PATH = "/";

    private final AgentOrchestrator orchestrator;
    private final MessageDispatcher dispatcher;
    private final Map<Session, SocketChannel> channels = new ConcurrentHashMap<>();
    private final AppLogger logger = AppLogger.get();

    public AgentSocketController(AgentOrchestrator orchestrator, MessageDispatcher dispatcher) {
        this.orchestrator = orchestrator;
        this.dispatcher = dispatcher;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.ws(PATH, ws -> {
            ws.onConnect(ctx -> {
                SocketChannel channel = new SocketChannel(ctx.session);
                channels.put(ctx.session, channel);
                log("New websocket connection " + channel.id() + " from " + ctx.session.getRemoteAddress());
                orchestrator.connection().attach(channel);
            });
            ws.onMessage(ctx -> {
                SocketChannel channel = channels.get(ctx.session);
                if (channel == null) {
                    // Message raced the connect callback
                    channel = new SocketChannel(ctx.session);
                    SocketChannel existing = channels.putIfAbsent(ctx.session, channel);
                    if (existing != null) {
                        channel = existing;
                    }
                }
                dispatcher.dispatch(channel, ctx.message());
            });
            ws.onClose(ctx -> {
                SocketChannel channel = channels.remove(ctx.session);
                if (channel != null) {
                    orchestrator.connection().detach(channel);
                }
            });
            ws.onError(ctx -> {
                Throwable error = ctx.error();
                logWarning("WebSocket error: " + (error != null ? error.getMessage() : "unknown"));
            });
        });
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[AgentSocket] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[AgentSocket] " + message);
        }
    }

    /**
     * {@link DuplexChannel} over a Jetty WebSocket session.
     */
    static final class SocketChannel implements DuplexChannel {

        private final Session session;
        private final String id = UUID.randomUUID().toString().substring(0, 8);

        SocketChannel(Session session) {
            this.session = session;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void send(String frame) throws IOException {
            if (!session.isOpen()) {
                throw new IOException("WebSocket " + id + " is closed");
            }
            session.getRemote().sendString(frame);
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void close() {
            session.close();
        }
    }
}
