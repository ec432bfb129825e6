package com.tool.execution.policy;

import com.tool.execution.core.error.InternalEngineException;
import com.tool.execution.core.error.ToolExecutionException;
import com.tool.execution.core.error.ToolTimeoutException;
import com.tool.execution.core.model.ToolArguments;
import com.tool.execution.core.model.ToolDefinition;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.core.model.ToolHandler;
import com.tool.execution.metrics.MetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RetryingExecutor Tests")
class RetryingExecutorTest {

    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private MetricsService metrics;
    private RetryingExecutor executor;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        metrics = mock(MetricsService.class);
        executor = new RetryingExecutor(workers, scheduler, metrics);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        scheduler.shutdownNow();
    }

    private ToolDefinition tool(ToolHandler handler) {
        return new ToolDefinition(ToolDescriptor.builder().name("flaky").build(), handler);
    }

    private static RetryPolicy policy(long timeoutMs, int retries, long delayMs) {
        return new RetryPolicy(Duration.ofMillis(timeoutMs), retries, Duration.ofMillis(delayMs));
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Nested
    @DisplayName("Successful execution")
    class Success {

        @Test
        @DisplayName("Handler result is converted to JSON on the first attempt")
        void firstAttempt() throws Exception {
            ExecutionOutcome outcome = executor.execute(tool(args -> Map.of("echo", args.getString("text"))),
                    ToolArguments.of(Map.of("text", "hi")), policy(1_000, 3, 10), "r1")
                    .get(5, TimeUnit.SECONDS);

            assertEquals("hi", outcome.value().get("echo").asText());
            assertEquals(1, outcome.attempts());
            verify(metrics, never()).incrementRetry(anyString());
        }

        @Test
        @DisplayName("Null handler result becomes JSON null")
        void nullResult() throws Exception {
            ExecutionOutcome outcome = executor.execute(tool(args -> null), ToolArguments.empty(),
                    policy(1_000, 0, 0), "r1").get(5, TimeUnit.SECONDS);

            assertTrue(outcome.value().isNull());
        }

        @Test
        @DisplayName("Transient failures are retried until an attempt succeeds")
        void retriedToSuccess() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ToolHandler handler = args -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalStateException("transient");
                }
                return "ok";
            };

            ExecutionOutcome outcome = executor.execute(tool(handler), ToolArguments.empty(),
                    policy(1_000, 3, 10), "r1").get(5, TimeUnit.SECONDS);

            assertEquals("ok", outcome.value().asText());
            assertEquals(3, outcome.attempts());
            verify(metrics, times(2)).incrementRetry("flaky");
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class Failures {

        @Test
        @DisplayName("Exhausted retries report every attempt and the last cause")
        void exhausted() {
            AtomicInteger calls = new AtomicInteger();
            ToolHandler handler = args -> {
                throw new IllegalStateException("boom-" + calls.incrementAndGet());
            };

            Throwable cause = failureOf(executor.execute(tool(handler), ToolArguments.empty(),
                    policy(1_000, 2, 5), "r1"));

            ToolExecutionException e = assertInstanceOf(ToolExecutionException.class, cause);
            assertEquals(3, e.getAttempts());
            assertEquals(3, calls.get());
            assertEquals(3, e.getFailures().size());
            assertEquals("boom-3", e.getCause().getMessage());
        }

        @Test
        @DisplayName("maxRetries of zero means exactly one attempt")
        void noRetries() {
            AtomicInteger calls = new AtomicInteger();
            ToolHandler handler = args -> {
                calls.incrementAndGet();
                throw new IllegalStateException("boom");
            };

            ToolExecutionException e = assertInstanceOf(ToolExecutionException.class,
                    failureOf(executor.execute(tool(handler), ToolArguments.empty(), policy(1_000, 0, 0), "r1")));

            assertEquals(1, e.getAttempts());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("A timed-out attempt is interrupted and retried")
        void timeoutThenRetry() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch interrupted = new CountDownLatch(1);
            ToolHandler handler = args -> {
                if (calls.incrementAndGet() == 1) {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                }
                return "second";
            };

            ExecutionOutcome outcome = executor.execute(tool(handler), ToolArguments.empty(),
                    policy(100, 1, 10), "r1").get(5, TimeUnit.SECONDS);

            assertEquals("second", outcome.value().asText());
            assertEquals(2, outcome.attempts());
            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
            verify(metrics).incrementTimeout("flaky");
        }

        @Test
        @DisplayName("Every attempt timing out yields an execution failure with timeout causes")
        void allTimedOut() {
            ToolHandler handler = args -> {
                Thread.sleep(10_000);
                return "never";
            };

            ToolExecutionException e = assertInstanceOf(ToolExecutionException.class,
                    failureOf(executor.execute(tool(handler), ToolArguments.empty(), policy(50, 1, 0), "r1")));

            assertEquals(2, e.getAttempts());
            assertTrue(e.timedOut(1));
            assertTrue(e.timedOut(2));
            assertInstanceOf(ToolTimeoutException.class, e.getCause());
        }

        @Test
        @DisplayName("Rejected submission surfaces as an internal error")
        void rejected() {
            workers.shutdownNow();

            Throwable cause = failureOf(executor.execute(tool(args -> "x"), ToolArguments.empty(),
                    policy(1_000, 0, 0), "r1"));

            assertInstanceOf(InternalEngineException.class, cause);
        }
    }

    @Test
    @DisplayName("Cancelling the result interrupts the running attempt and stops retries")
    void cancellation() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        ToolHandler handler = args -> {
            calls.incrementAndGet();
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        };

        CompletableFuture<ExecutionOutcome> future = executor.execute(tool(handler), ToolArguments.empty(),
                policy(30_000, 3, 0), "r1");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        future.cancel(true);

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(1, calls.get());
        assertTrue(future.isCancelled());
    }
}
