package com.defiguard.gateway;

import com.defiguard.exception.BaseException;
import com.defiguard.governance.ExecutionResult;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolCallStatus;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolStep;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link ToolExchange} through SENT -> STREAMING* -> DONE | ERROR.
 *
 * <p>Each {@code advance()} runs on the tool executor so the driver can stop waiting.
 * The call is abandoned, never recorded, when any of these happens first:
 * <ul>
 *   <li>the overall call timeout elapses</li>
 *   <li>the exchange takes {@code maxSteps} steps without reaching a terminal status</li>
 *   <li>the cancellation check turns true (the evaluation was revoked)</li>
 * </ul>
 */
public class ToolCallDriver {

    private static final Logger log = LoggerFactory.getLogger(ToolCallDriver.class);

    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ExecutorService executor;
    private final Duration callTimeout;
    private final int maxSteps;

    public ToolCallDriver(ExecutorService executor, Duration callTimeout, int maxSteps) {
        this.executor = executor;
        this.callTimeout = callTimeout;
        this.maxSteps = maxSteps;
    }

    public ExecutionResult drive(ToolExchange exchange, ToolCallContext context, BooleanSupplier cancelled) {
        long deadline = System.nanoTime() + callTimeout.toNanos();
        ToolCallStatus state = ToolCallStatus.SENT;
        int steps = 0;

        while (true) {
            if (cancelled.getAsBoolean()) {
                return abandon(context, "Evaluation cancelled before the tool call completed", steps);
            }
            if (steps >= maxSteps) {
                return abandon(context, "Tool call did not complete within " + maxSteps + " steps", steps);
            }

            Future<ToolStep> future;
            try {
                future = executor.submit(exchange::advance);
            } catch (RejectedExecutionException e) {
                log.error("Tool executor rejected step [callId={}]", context.getCallId());
                return ExecutionResult.failed("Tool executor is saturated", steps);
            }

            ToolStep step;
            try {
                step = await(future, deadline, cancelled);
            } catch (TimeoutException e) {
                future.cancel(true);
                return abandon(context, "Tool call timed out after " + callTimeout.toMillis() + " ms", steps);
            } catch (EvaluationCancelledException e) {
                future.cancel(true);
                return abandon(context, "Evaluation cancelled before the tool call completed", steps);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return abandon(context, "Tool call interrupted", steps);
            } catch (ExecutionException e) {
                return failure(context, e.getCause(), steps + 1);
            }
            steps++;

            if (step == null || step.getStatus() == null) {
                return ExecutionResult.failed("Tool returned an empty step", steps);
            }
            switch (step.getStatus()) {
                case DONE -> {
                    log.debug("Tool call done [callId={}, steps={}]", context.getCallId(), steps);
                    return ExecutionResult.succeeded(step.getOutput(), steps);
                }
                case ERROR -> {
                    log.warn("Tool call error [callId={}, tool={}, message={}]", context.getCallId(),
                            context.getToolName(), step.getErrorMessage());
                    return ExecutionResult.failed(
                            step.getErrorMessage() != null ? step.getErrorMessage() : "Tool reported an error",
                            steps);
                }
                default -> {
                    log.debug("Tool call {} -> {} [callId={}, step={}]", state, step.getStatus(),
                            context.getCallId(), steps);
                    state = step.getStatus();
                }
            }
        }
    }

    /** Waits for one step in short slices so cancellation is noticed while the tool runs. */
    private static ToolStep await(Future<ToolStep> future, long deadline, BooleanSupplier cancelled)
            throws TimeoutException, InterruptedException, ExecutionException, EvaluationCancelledException {
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException();
            }
            try {
                return future.get(Math.min(remaining, POLL_NANOS), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (cancelled.getAsBoolean()) {
                    throw new EvaluationCancelledException();
                }
            }
        }
    }

    private static ExecutionResult failure(ToolCallContext context, Throwable cause, int steps) {
        if (cause instanceof BaseException baseException) {
            log.warn("Tool call failed [callId={}, tool={}, code={}, message={}]", context.getCallId(),
                    context.getToolName(), baseException.getErrorCode().getCode(), baseException.getMessage());
            return ExecutionResult.failed(baseException.getMessage(), steps);
        }
        log.error("Tool call failed unexpectedly [callId={}, tool={}]", context.getCallId(), context.getToolName(),
                cause);
        return ExecutionResult.failed("Tool execution failed", steps);
    }

    private static ExecutionResult abandon(ToolCallContext context, String reason, int steps) {
        log.warn("Tool call abandoned [callId={}, tool={}, steps={}]: {}", context.getCallId(),
                context.getToolName(), steps, reason);
        return ExecutionResult.abandoned(reason, steps);
    }

    /** Raised by {@link #await} when the evaluation is revoked mid-step. */
    private static final class EvaluationCancelledException extends Exception {
        private EvaluationCancelledException() {
            super(null, null, false, false);
        }
    }
}
