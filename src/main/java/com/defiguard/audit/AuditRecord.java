package com.defiguard.audit;

import com.defiguard.governance.GovernanceStage;
import com.defiguard.tool.ActionKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One entry in the append-only audit stream. Holds no key material; argument values
 * have been passed through {@link ArgumentRedactor}.
 */
@Getter
@Builder
@ToString(exclude = "arguments")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditRecord {

    /** Monotonic per process, starting at 1. */
    private final long sequence;

    private final Instant timestamp;
    private final String callId;
    private final String evaluationId;
    private final String tool;
    private final ActionKind actionKind;
    private final AuditOutcome outcome;

    /** Blocking stage, for BLOCKED records. */
    private final GovernanceStage stage;

    private final String code;
    private final String reason;
    private final String ruleId;
    private final BigDecimal tradeValueUsd;
    private final String network;
    private final JsonNode arguments;
    private final Map<String, Object> details;
    private final Long latencyMs;
}
