package com.defiguard.governance;

import com.defiguard.tool.ToolCallContext;

/**
 * One governance stage.
 *
 * <p>For every call that passes {@link #decide}, the pipeline later calls exactly one of
 * {@link #record} (the call reached a successful terminal state) or {@link #release}
 * (blocked by a later stage, failed, or abandoned). Stateful stages reserve capacity in
 * {@code decide} and confirm or return it there. Both hooks must tolerate call ids they
 * hold nothing for.
 */
public interface ToolCallInterceptor {

    GovernanceStage stage();

    InterceptorDecision decide(ToolCallContext context);

    default void record(ToolCallContext context) {}

    default void release(ToolCallContext context) {}
}
