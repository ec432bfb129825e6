package com.tool.execution.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tool.execution.core.error.InternalEngineException;
import com.tool.execution.core.error.ToolExecutionException;
import com.tool.execution.core.error.ToolTimeoutException;
import com.tool.execution.core.model.ToolArguments;
import com.tool.execution.core.model.ToolDefinition;
import com.tool.execution.logging.LogContext;
import com.tool.execution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs tool handlers under a {@link RetryPolicy}.
 *
 * <p>Each attempt runs on the worker pool with a deadline scheduled on the scheduler. An
 * attempt that misses its deadline is abandoned with a {@link ToolTimeoutException} and its
 * worker is interrupted; handlers that ignore interruption keep running in the background
 * but their result is discarded. Between attempts the executor waits {@code retryDelay}
 * on the scheduler, so no thread is parked during the wait.</p>
 *
 * <p>Cancelling the returned future stops further attempts, cancels a pending retry and
 * interrupts the attempt in flight.</p>
 */
public class RetryingExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final MetricsService metricsService;

    public RetryingExecutor(ExecutorService workers, ScheduledExecutorService scheduler,
                            MetricsService metricsService) {
        this.workers = Objects.requireNonNull(workers, "workers is required");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Starts executing the tool. The future completes with the produced value, or
     * exceptionally with a {@link ToolExecutionException} once every attempt has failed.
     */
    public CompletableFuture<ExecutionOutcome> execute(ToolDefinition definition, ToolArguments arguments,
                                                       RetryPolicy policy, String requestId) {
        Execution execution = new Execution(definition, arguments, policy, requestId);
        execution.runAttempt();
        return execution.result;
    }

    private final class Execution {
        private final ToolDefinition definition;
        private final ToolArguments arguments;
        private final RetryPolicy policy;
        private final String requestId;
        private final CompletableFuture<ExecutionOutcome> result = new CompletableFuture<>();
        private final List<Throwable> failures = new CopyOnWriteArrayList<>();

        private volatile int attempt;
        private volatile Future<?> currentTask;
        private volatile ScheduledFuture<?> currentDeadline;
        private volatile ScheduledFuture<?> pendingRetry;

        Execution(ToolDefinition definition, ToolArguments arguments, RetryPolicy policy, String requestId) {
            this.definition = definition;
            this.arguments = arguments;
            this.policy = policy;
            this.requestId = requestId;
            result.whenComplete((outcome, error) -> {
                if (result.isCancelled()) {
                    cancelPending();
                }
            });
        }

        void runAttempt() {
            if (result.isDone()) {
                return;
            }
            int number = ++attempt;
            AtomicBoolean settled = new AtomicBoolean();
            long deadlineNanos = policy.timeout().toNanos();
            try {
                Future<?> task = workers.submit(() -> runHandler(number, settled));
                currentTask = task;
                ScheduledFuture<?> deadline = scheduler.schedule(() -> {
                    if (settled.compareAndSet(false, true)) {
                        task.cancel(true);
                        metricsService.incrementTimeout(definition.name());
                        onFailure(number, new ToolTimeoutException(definition.name(), number, policy.timeout()));
                    }
                }, deadlineNanos, TimeUnit.NANOSECONDS);
                currentDeadline = deadline;
                if (settled.get()) {
                    deadline.cancel(false);
                }
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(new InternalEngineException("Executor rejected tool attempt", e));
            }
        }

        private void runHandler(int number, AtomicBoolean settled) {
            try (LogContext ctx = LogContext.forInvocation(requestId, definition.name())
                    .with("attempt", String.valueOf(number))) {
                log.debug("tool.attempt.started tool={} attempt={}", definition.name(), number);
                Object raw = definition.handler().handle(arguments);
                JsonNode value = raw == null ? NullNode.getInstance() : MAPPER.valueToTree(raw);
                if (settled.compareAndSet(false, true)) {
                    cancelDeadline();
                    result.complete(new ExecutionOutcome(value, number));
                }
            } catch (Throwable t) {
                if (settled.compareAndSet(false, true)) {
                    cancelDeadline();
                    onFailure(number, t);
                }
            }
        }

        private void onFailure(int number, Throwable cause) {
            failures.add(cause);
            if (result.isDone()) {
                return;
            }
            if (number < policy.maxAttempts()) {
                log.warn("tool.attempt.failed tool={} attempt={} retryInMs={} cause={}",
                        definition.name(), number, policy.retryDelay().toMillis(), cause.toString());
                metricsService.incrementRetry(definition.name());
                try {
                    ScheduledFuture<?> retry = scheduler.schedule(this::runAttempt,
                            policy.retryDelay().toNanos(), TimeUnit.NANOSECONDS);
                    pendingRetry = retry;
                    if (result.isDone()) {
                        retry.cancel(false);
                    }
                } catch (RejectedExecutionException e) {
                    result.completeExceptionally(new InternalEngineException("Scheduler rejected tool retry", e));
                }
            } else {
                log.warn("tool.attempts.exhausted tool={} attempts={} cause={}",
                        definition.name(), number, cause.toString());
                result.completeExceptionally(new ToolExecutionException(definition.name(), number, failures));
            }
        }

        private void cancelDeadline() {
            ScheduledFuture<?> deadline = currentDeadline;
            if (deadline != null) {
                deadline.cancel(false);
            }
        }

        private void cancelPending() {
            ScheduledFuture<?> retry = pendingRetry;
            if (retry != null) {
                retry.cancel(false);
            }
            cancelDeadline();
            Future<?> task = currentTask;
            if (task != null) {
                task.cancel(true);
            }
            log.debug("tool.execution.cancelled tool={} attempt={}", definition.name(), attempt);
        }
    }
}
