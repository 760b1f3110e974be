package com.defiguard.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable description of one tool call, built by the gateway and read by every
 * governance stage.
 *
 * <p>{@code rawArguments} is a private deep copy of what the script sent; it is kept
 * only for redacted audit context. Governance stages work from the typed fields.
 */
@Getter
public class ToolCallContext {

    private final String callId;
    private final String evaluationId;
    private final ToolName toolName;
    private final ToolArguments arguments;
    private final JsonNode rawArguments;
    private final ActionKind actionKind;
    private final BigDecimal tradeValue;
    private final BigDecimal slippagePercent;
    private final BigDecimal priceImpactPercent;
    private final Network network;
    /** Cooldown key for per-symbol cooldowns, e.g. input/output token pair. */
    private final String symbol;

    private final Instant requestedAt;

    @Builder
    private ToolCallContext(
            String callId,
            String evaluationId,
            ToolName toolName,
            ToolArguments arguments,
            JsonNode rawArguments,
            ActionKind actionKind,
            BigDecimal tradeValue,
            BigDecimal slippagePercent,
            BigDecimal priceImpactPercent,
            Network network,
            String symbol,
            Instant requestedAt) {
        this.callId = Objects.requireNonNull(callId, "callId");
        this.evaluationId = evaluationId;
        this.toolName = Objects.requireNonNull(toolName, "toolName");
        this.arguments = arguments;
        this.rawArguments =
                rawArguments != null ? rawArguments.deepCopy() : JsonNodeFactory.instance.objectNode();
        this.actionKind = actionKind != null ? actionKind : ActionKind.READ_ONLY;
        this.tradeValue = tradeValue;
        this.slippagePercent = slippagePercent;
        this.priceImpactPercent = priceImpactPercent;
        this.network = network;
        this.symbol = symbol;
        this.requestedAt = requestedAt != null ? requestedAt : Instant.now();
    }

    /** Returns a copy so callers cannot mutate the context's argument tree. */
    public JsonNode getRawArguments() {
        return rawArguments.deepCopy();
    }

    public Optional<BigDecimal> getTradeValue() {
        return Optional.ofNullable(tradeValue);
    }

    public Optional<BigDecimal> getSlippagePercent() {
        return Optional.ofNullable(slippagePercent);
    }

    public Optional<BigDecimal> getPriceImpactPercent() {
        return Optional.ofNullable(priceImpactPercent);
    }

    public boolean isCapitalCommitting() {
        return actionKind == ActionKind.CAPITAL_COMMITTING;
    }

    @Override
    public String toString() {
        return "ToolCallContext{callId=" + callId + ", tool=" + toolName + ", action=" + actionKind
                + ", tradeValue=" + tradeValue + ", network=" + (network != null ? network.getWireName() : null)
                + "}";
    }
}
