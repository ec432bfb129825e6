package com.tool.execution.websocket;

import com.tool.execution.logging.LogContext;
import com.tool.execution.protocol.SessionRegistry;
import com.tool.execution.protocol.StreamingSession;
import jakarta.inject.Inject;
import jakarta.websocket.CloseReason;
import jakarta.websocket.OnClose;
import jakarta.websocket.OnError;
import jakarta.websocket.OnMessage;
import jakarta.websocket.OnOpen;
import jakarta.websocket.Session;
import jakarta.websocket.server.ServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * WebSocket transport at {@code /ws}. Each connection becomes a {@link StreamingSession};
 * text frames carry protocol envelopes in both directions.
 */
@ServerEndpoint("/ws")
public class ToolWebSocketEndpoint {
    private static final Logger log = LoggerFactory.getLogger(ToolWebSocketEndpoint.class);

    @Inject
    SessionRegistry sessionRegistry;

    public ToolWebSocketEndpoint() {
    }

    ToolWebSocketEndpoint(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @OnOpen
    public void onOpen(Session session) {
        sessionRegistry.open(session.getId(), message -> session.getBasicRemote().sendText(message));
    }

    @OnMessage
    public void onMessage(String message, Session session) {
        Optional<StreamingSession> streaming = sessionRegistry.find(session.getId());
        if (streaming.isEmpty()) {
            log.warn("ws.message.unknown_session sessionId={}", session.getId());
            return;
        }
        streaming.get().onMessage(message);
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        try (LogContext ctx = LogContext.forSession(session.getId())) {
            log.debug("ws.closed sessionId={} reason={}", session.getId(),
                    reason != null ? reason.getCloseCode() : "unknown");
        }
        sessionRegistry.close(session.getId());
    }

    @OnError
    public void onError(Session session, Throwable error) {
        try (LogContext ctx = LogContext.forSession(session.getId())) {
            log.warn("ws.error sessionId={} error={}", session.getId(), error.getMessage());
        }
        sessionRegistry.close(session.getId());
    }
}
