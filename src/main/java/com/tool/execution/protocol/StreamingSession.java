package com.tool.execution.protocol;

import com.tool.execution.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A persistent connection carrying many protocol requests.
 *
 * <p>Every message is dispatched independently and its response is sent as soon as it is
 * ready, so responses may arrive out of request order; callers correlate them by id.
 * Sends are serialized per session. Closing the session cancels every request still in
 * flight, and their responses are dropped.</p>
 */
public class StreamingSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StreamingSession.class);

    private final String sessionId;
    private final ProtocolHandler handler;
    private final MessageSink sink;
    private final Set<CompletableFuture<String>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object sendLock = new Object();

    public StreamingSession(String sessionId, ProtocolHandler handler, MessageSink sink) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId is required");
        this.handler = Objects.requireNonNull(handler, "handler is required");
        this.sink = Objects.requireNonNull(sink, "sink is required");
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Dispatches one inbound message. Returns immediately.
     */
    public void onMessage(String message) {
        if (closed.get()) {
            log.debug("session.message.ignored sessionId={} reason=closed", sessionId);
            return;
        }
        CompletableFuture<String> response = handler.handle(message);
        inFlight.add(response);
        if (closed.get()) {
            // closed while the request was being dispatched
            inFlight.remove(response);
            response.cancel(true);
            return;
        }
        response.whenComplete((json, error) -> {
            inFlight.remove(response);
            if (error == null && !closed.get()) {
                send(json);
            }
        });
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void send(String json) {
        synchronized (sendLock) {
            try {
                sink.send(json);
            } catch (IOException e) {
                try (LogContext ctx = LogContext.forSession(sessionId)) {
                    log.warn("session.send.failed sessionId={} error={}", sessionId, e.getMessage());
                }
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int cancelled = 0;
        for (CompletableFuture<String> pending : new ArrayList<>(inFlight)) {
            if (pending.cancel(true)) {
                cancelled++;
            }
        }
        inFlight.clear();
        try (LogContext ctx = LogContext.forSession(sessionId)) {
            log.info("session.closed sessionId={} cancelledRequests={}", sessionId, cancelled);
        }
    }
}
