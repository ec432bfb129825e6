package com.tool.execution.registry;

import com.tool.execution.core.error.DuplicateToolException;
import com.tool.execution.core.error.ErrorCode;
import com.tool.execution.core.error.ToolNotFoundException;
import com.tool.execution.core.model.ToolDefinition;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.core.model.ToolHandler;
import com.tool.execution.policy.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ToolRegistry Tests")
class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
    }

    private static ToolDescriptor named(String name) {
        return ToolDescriptor.builder().name(name).build();
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Registered tool can be looked up")
        void registerAndLookup() {
            registry.register(named("echo"), args -> args.getString("text"));

            ToolDefinition definition = registry.lookup("echo");

            assertEquals("echo", definition.name());
            assertTrue(registry.contains("echo"));
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("Duplicate names are rejected and the first registration is kept")
        void duplicateRejected() {
            registry.register(named("echo"), args -> "first");

            DuplicateToolException e = assertThrows(DuplicateToolException.class,
                    () -> registry.register(named("echo"), args -> "second"));

            assertEquals(ErrorCode.DUPLICATE_NAME, e.getCode());
            assertEquals(1, registry.size());
            assertEquals(1, registry.list().size());
        }

        @Test
        @DisplayName("Invalid policy settings are rejected at registration")
        void invalidConfiguration() {
            assertThrows(IllegalArgumentException.class, () -> registry.register(
                    ToolDescriptor.builder().name("a").timeout(Duration.ZERO).build(), args -> null));
            assertThrows(IllegalArgumentException.class, () -> registry.register(
                    ToolDescriptor.builder().name("b").retryDelay(Duration.ofMillis(-1)).build(), args -> null));
            assertThrows(IllegalArgumentException.class, () -> registry.register(
                    ToolDescriptor.builder().name("c").cacheTtl(Duration.ofSeconds(-1)).build(), args -> null));
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("Durations the scheduler cannot express are rejected before any handler runs")
        void oversizedDurations() {
            AtomicInteger calls = new AtomicInteger();
            ToolHandler handler = args -> calls.incrementAndGet();

            assertThrows(IllegalArgumentException.class, () -> registry.register(
                    ToolDescriptor.builder().name("slow").timeout(Duration.ofDays(365L * 400)).build(), handler));
            assertThrows(IllegalArgumentException.class, () -> registry.register(
                    ToolDescriptor.builder().name("patient").retryDelay(Duration.ofDays(365L * 400)).build(), handler));
            assertThrows(IllegalArgumentException.class, () -> registry.register(
                    ToolDescriptor.builder().name("forever").cacheTtl(Duration.ofSeconds(Long.MAX_VALUE)).build(),
                    handler));
            assertEquals(0, registry.size());
            assertEquals(0, calls.get());

            registry.register(ToolDescriptor.builder().name("long").timeout(RetryPolicy.MAX_DURATION).build(), handler);
            assertTrue(registry.find("long").isPresent());
        }

        @Test
        @DisplayName("Exactly one concurrent registration of a name wins")
        void concurrentRegistration() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            AtomicInteger duplicates = new AtomicInteger();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    futures.add(pool.submit(() -> {
                        try {
                            registry.register(named("shared"), args -> null);
                        } catch (DuplicateToolException e) {
                            duplicates.incrementAndGet();
                        }
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(15, duplicates.get());
            assertEquals(1, registry.size());
        }
    }

    @Nested
    @DisplayName("Lookup and listing")
    class LookupAndListing {

        @Test
        @DisplayName("Unknown name raises NOT_FOUND")
        void unknown() {
            ToolNotFoundException e = assertThrows(ToolNotFoundException.class, () -> registry.lookup("missing"));

            assertEquals(ErrorCode.NOT_FOUND, e.getCode());
            assertTrue(registry.find("missing").isEmpty());
            assertTrue(registry.find(null).isEmpty());
        }

        @Test
        @DisplayName("Listing keeps registration order")
        void listingOrder() {
            registry.register(named("c"), args -> null);
            registry.register(named("a"), args -> null);
            registry.register(named("b"), args -> null);

            List<String> names = registry.list().stream().map(ToolDescriptor::getName).toList();

            assertEquals(List.of("c", "a", "b"), names);
        }

        @Test
        @DisplayName("Listing is a snapshot")
        void listingSnapshot() {
            registry.register(named("a"), args -> null);
            List<ToolDescriptor> snapshot = registry.list();

            registry.register(named("b"), args -> null);

            assertEquals(1, snapshot.size());
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add(named("x")));
        }
    }
}
