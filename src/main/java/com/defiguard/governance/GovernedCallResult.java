package com.defiguard.governance;

import com.defiguard.tool.ToolCallContext;
import java.time.Duration;
import lombok.Getter;

/**
 * Final result of one governed call: either blocked at a stage, or admitted and
 * executed with an {@link ExecutionResult}.
 */
@Getter
public final class GovernedCallResult {

    private final ToolCallContext context;
    private final InterceptorDecision decision;
    /** Stage that blocked the call; null when admitted. */
    private final GovernanceStage blockedAt;
    /** Null when blocked. */
    private final ExecutionResult execution;

    private Duration latency = Duration.ZERO;

    private GovernedCallResult(
            ToolCallContext context,
            InterceptorDecision decision,
            GovernanceStage blockedAt,
            ExecutionResult execution) {
        this.context = context;
        this.decision = decision;
        this.blockedAt = blockedAt;
        this.execution = execution;
    }

    static GovernedCallResult blocked(ToolCallContext context, GovernanceStage stage, InterceptorDecision decision) {
        return new GovernedCallResult(context, decision, stage, null);
    }

    static GovernedCallResult executed(ToolCallContext context, ExecutionResult execution) {
        return new GovernedCallResult(context, InterceptorDecision.allow(), null, execution);
    }

    void setLatency(Duration latency) {
        this.latency = latency;
    }

    public boolean isBlocked() {
        return blockedAt != null;
    }

    public boolean isSucceeded() {
        return execution != null && execution.isSucceeded();
    }

    @Override
    public String toString() {
        return "GovernedCallResult{callId=" + context.getCallId() + ", tool=" + context.getToolName()
                + (isBlocked() ? ", blockedAt=" + blockedAt + ", decision=" + decision
                        : ", outcome=" + execution.getOutcome())
                + "}";
    }
}
