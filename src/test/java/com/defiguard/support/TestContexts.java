package com.defiguard.support;

import com.defiguard.tool.ActionKind;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolName;
import java.math.BigDecimal;

/** Shorthand for building {@link ToolCallContext}s in stage tests. */
public final class TestContexts {

    private TestContexts() {}

    public static ToolCallContext capital(String callId, String tradeValueUsd) {
        return ToolCallContext.builder()
                .callId(callId)
                .evaluationId("eval-test")
                .toolName(ToolName.ODOS_SWAP)
                .actionKind(ActionKind.CAPITAL_COMMITTING)
                .tradeValue(tradeValueUsd != null ? new BigDecimal(tradeValueUsd) : null)
                .build();
    }

    public static ToolCallContext quote(String callId, String tradeValueUsd) {
        return ToolCallContext.builder()
                .callId(callId)
                .evaluationId("eval-test")
                .toolName(ToolName.ODOS_SWAP)
                .actionKind(ActionKind.READ_ONLY)
                .tradeValue(new BigDecimal(tradeValueUsd))
                .build();
    }

    public static ToolCallContext signing(String callId, ToolName toolName) {
        return ToolCallContext.builder()
                .callId(callId)
                .evaluationId("eval-test")
                .toolName(toolName)
                .actionKind(ActionKind.SIGNING)
                .build();
    }
}
