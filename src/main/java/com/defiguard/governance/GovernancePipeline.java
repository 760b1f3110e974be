package com.defiguard.governance;

import com.defiguard.audit.AuditLog;
import com.defiguard.exception.ConfigurationException;
import com.defiguard.observability.GovernanceMetrics;
import com.defiguard.tool.ToolCallContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every tool call through the governance stages and, if all of them allow it,
 * through its execution.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Policy, Spend Limit, Slippage, Cooldown in {@link GovernanceStage} order; the
 *       first Block stops evaluation and the stages that already allowed are released</li>
 *   <li>Execution via the supplied function, which must return a terminal result</li>
 *   <li>{@code record} on every stage if the call succeeded, {@code release} otherwise</li>
 *   <li>Audit and metrics, in a {@code finally} so they run however the call ended</li>
 * </ol>
 *
 * <p>A stage that throws is treated as a Block ({@code STAGE_FAILURE}). An execution
 * function that throws is treated as a failed execution.
 *
 * <p>The stage order is fixed at construction: the constructor sorts interceptors by
 * stage and refuses any set that is not exactly one interceptor per stage.
 */
public class GovernancePipeline {

    private static final Logger log = LoggerFactory.getLogger(GovernancePipeline.class);

    private final List<ToolCallInterceptor> interceptors;
    private final AuditLog auditLog;
    private final GovernanceMetrics governanceMetrics;

    public GovernancePipeline(
            List<ToolCallInterceptor> interceptors, AuditLog auditLog, GovernanceMetrics governanceMetrics) {
        List<ToolCallInterceptor> ordered = new ArrayList<>(interceptors);
        ordered.sort(Comparator.comparing(ToolCallInterceptor::stage));

        Set<GovernanceStage> seen = EnumSet.noneOf(GovernanceStage.class);
        for (ToolCallInterceptor interceptor : ordered) {
            if (!seen.add(interceptor.stage())) {
                throw new ConfigurationException("More than one interceptor for stage " + interceptor.stage());
            }
        }
        Set<GovernanceStage> missing = EnumSet.allOf(GovernanceStage.class);
        missing.removeAll(seen);
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Governance pipeline is missing stages " + missing);
        }

        this.interceptors = List.copyOf(ordered);
        this.auditLog = auditLog;
        this.governanceMetrics = governanceMetrics;
        log.info("Governance pipeline initialized: {}", this.interceptors.stream()
                .map(interceptor -> interceptor.stage().getLabel())
                .toList());
    }

    /**
     * Governs and executes one call.
     *
     * @param context  the immutable call description
     * @param executor drives the admitted call to a terminal state
     */
    public GovernedCallResult run(ToolCallContext context, Function<ToolCallContext, ExecutionResult> executor) {
        long startNanos = System.nanoTime();
        GovernedCallResult result = null;
        List<ToolCallInterceptor> admitted = new ArrayList<>(interceptors.size());
        try {
            for (ToolCallInterceptor interceptor : interceptors) {
                InterceptorDecision decision = decide(interceptor, context);
                if (decision.isBlocked()) {
                    releaseAll(admitted, context);
                    result = GovernedCallResult.blocked(context, interceptor.stage(), decision);
                    return result;
                }
                admitted.add(interceptor);
            }

            ExecutionResult execution = execute(executor, context);
            if (execution.isSucceeded()) {
                recordAll(admitted, context);
            } else {
                releaseAll(admitted, context);
            }
            result = GovernedCallResult.executed(context, execution);
            return result;
        } finally {
            if (result == null) {
                // an Error escaped: nothing may stay reserved and the attempt is still audited
                releaseAll(admitted, context);
                result = GovernedCallResult.executed(
                        context, ExecutionResult.failed("Internal error while executing tool call", 0));
            }
            result.setLatency(Duration.ofNanos(System.nanoTime() - startNanos));
            auditLog.recordGovernedCall(result);
            governanceMetrics.recordCall(result);
        }
    }

    public List<GovernanceStage> getStages() {
        return interceptors.stream().map(ToolCallInterceptor::stage).toList();
    }

    private static InterceptorDecision decide(ToolCallInterceptor interceptor, ToolCallContext context) {
        try {
            InterceptorDecision decision = interceptor.decide(context);
            if (decision == null) {
                log.error("Stage {} returned no decision [callId={}]; blocking", interceptor.stage(),
                        context.getCallId());
                return InterceptorDecision.stageFailure(interceptor.stage());
            }
            return decision;
        } catch (RuntimeException e) {
            log.error("Stage {} failed [callId={}]; blocking", interceptor.stage(), context.getCallId(), e);
            return InterceptorDecision.stageFailure(interceptor.stage());
        }
    }

    private static ExecutionResult execute(
            Function<ToolCallContext, ExecutionResult> executor, ToolCallContext context) {
        try {
            ExecutionResult execution = executor.apply(context);
            return execution != null ? execution : ExecutionResult.failed("Tool returned no result", 0);
        } catch (RuntimeException e) {
            log.error("Tool execution failed [callId={}, tool={}]", context.getCallId(), context.getToolName(), e);
            return ExecutionResult.failed("Tool execution failed", 0);
        }
    }

    private static void recordAll(List<ToolCallInterceptor> admitted, ToolCallContext context) {
        for (ToolCallInterceptor interceptor : admitted) {
            try {
                interceptor.record(context);
            } catch (RuntimeException e) {
                log.error("Stage {} failed to record [callId={}]", interceptor.stage(), context.getCallId(), e);
            }
        }
    }

    private static void releaseAll(List<ToolCallInterceptor> admitted, ToolCallContext context) {
        for (ToolCallInterceptor interceptor : admitted) {
            try {
                interceptor.release(context);
            } catch (RuntimeException e) {
                log.error("Stage {} failed to release [callId={}]", interceptor.stage(), context.getCallId(), e);
            }
        }
    }
}
