package com.tool.execution.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.engine.ToolEngine;
import com.tool.execution.registry.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreamingSession Tests")
class StreamingSessionTest {

    @Mock
    private ProtocolHandler dispatcher;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch slowStarted = new CountDownLatch(1);
    private final CountDownLatch slowInterrupted = new CountDownLatch(1);

    private ToolEngine engine;
    private SessionRegistry sessions;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(ToolDescriptor.builder().name("fast").build(), args -> "fast");
        registry.register(ToolDescriptor.builder().name("slow").cacheable(false).build(), args -> {
            slowStarted.countDown();
            try {
                if (!release.await(30, TimeUnit.SECONDS)) {
                    return "timed out waiting";
                }
            } catch (InterruptedException e) {
                slowInterrupted.countDown();
                throw e;
            }
            return "slow";
        });
        engine = ToolEngine.builder().registry(registry).build();
        sessions = new SessionRegistry(new ProtocolHandler(engine));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        sessions.closeAll();
        engine.close();
    }

    private static String call(String id, String tool) {
        return "{\"id\":\"" + id + "\",\"method\":\"tools/call\",\"params\":{\"name\":\"" + tool + "\"}}";
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean());
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("A fast request is answered while a slow one is still running")
        void outOfOrderResponses() throws Exception {
            StreamingSession session = sessions.open("s1", sent::add);

            session.onMessage(call("1", "slow"));
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
            session.onMessage(call("2", "fast"));

            waitUntil(() -> sent.size() == 1);
            assertEquals("2", mapper.readTree(sent.get(0)).get("id").asText());
            assertEquals(1, session.getInFlightCount());

            release.countDown();
            waitUntil(() -> sent.size() == 2);
            JsonNode slow = mapper.readTree(sent.get(1));
            assertEquals("1", slow.get("id").asText());
            assertEquals("slow", slow.get("result").get("content").asText());
        }

        @Test
        @DisplayName("Malformed messages get an error response and the session stays open")
        void malformedMessage() throws Exception {
            StreamingSession session = sessions.open("s1", sent::add);

            session.onMessage("garbage");
            session.onMessage(call("2", "fast"));

            waitUntil(() -> sent.size() == 2);
            assertEquals("INVALID_REQUEST", mapper.readTree(sent.get(0)).get("error").get("code").asText());
            assertFalse(session.isClosed());
        }

        @Test
        @DisplayName("A failing sink does not break the session")
        void sinkFailure() throws Exception {
            StreamingSession session = sessions.open("s1", message -> {
                throw new IOException("connection reset");
            });

            session.onMessage(call("1", "fast"));

            waitUntil(() -> session.getInFlightCount() == 0);
            assertFalse(session.isClosed());
        }
    }

    @Nested
    @DisplayName("Closing")
    class Closing {

        @Test
        @DisplayName("Closing cancels in-flight requests and drops their responses")
        void closeCancelsInFlight() throws Exception {
            StreamingSession session = sessions.open("s1", sent::add);
            session.onMessage(call("1", "slow"));
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

            sessions.close("s1");

            assertTrue(slowInterrupted.await(5, TimeUnit.SECONDS));
            assertTrue(session.isClosed());
            Thread.sleep(100);
            assertTrue(sent.isEmpty());
            assertEquals(0, sessions.activeCount());
        }

        @Test
        @DisplayName("A request dispatched while the session closes is cancelled")
        void closeDuringDispatch() throws Exception {
            CompletableFuture<String> pending = new CompletableFuture<>();
            StreamingSession session = new StreamingSession("s1", dispatcher, sent::add);
            when(dispatcher.handle("m")).thenAnswer(invocation -> {
                session.close();
                return pending;
            });

            session.onMessage("m");

            assertTrue(pending.isCancelled());
            assertEquals(0, session.getInFlightCount());
            assertTrue(sent.isEmpty());
            verify(dispatcher).handle("m");
        }

        @Test
        @DisplayName("Messages after close are ignored")
        void messagesAfterClose() throws Exception {
            StreamingSession session = sessions.open("s1", sent::add);
            session.close();

            session.onMessage(call("1", "fast"));

            Thread.sleep(100);
            assertTrue(sent.isEmpty());
        }
    }

    @Nested
    @DisplayName("SessionRegistry")
    class Registry {

        @Test
        @DisplayName("Sessions are tracked by id and duplicates are rejected")
        void tracking() {
            StreamingSession first = sessions.open("s1", sent::add);
            StreamingSession generated = sessions.open(sent::add);

            assertEquals(2, sessions.activeCount());
            assertSame(first, sessions.find("s1").orElseThrow());
            assertNotNull(generated.getSessionId());
            assertThrows(IllegalArgumentException.class, () -> sessions.open("s1", sent::add));

            sessions.close("unknown");
            sessions.closeAll();
            assertEquals(0, sessions.activeCount());
            assertTrue(first.isClosed());
        }
    }
}
