package com.tool.execution.protocol;

import com.tool.execution.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks active streaming sessions.
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ProtocolHandler handler;
    private final Map<String, StreamingSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(ProtocolHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler is required");
    }

    /**
     * Opens a session with a generated id.
     */
    public StreamingSession open(MessageSink sink) {
        return open(UUID.randomUUID().toString(), sink);
    }

    public StreamingSession open(String sessionId, MessageSink sink) {
        StreamingSession session = new StreamingSession(sessionId, handler, sink);
        if (sessions.putIfAbsent(sessionId, session) != null) {
            throw new IllegalArgumentException("Session already open: " + sessionId);
        }
        try (LogContext ctx = LogContext.forSession(sessionId)) {
            log.info("session.opened sessionId={} active={}", sessionId, sessions.size());
        }
        return session;
    }

    public Optional<StreamingSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Closes and forgets a session. Unknown ids are ignored.
     */
    public void close(String sessionId) {
        StreamingSession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
        }
    }

    public void closeAll() {
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            close(sessionId);
        }
    }

    public int activeCount() {
        return sessions.size();
    }
}
