package com.defiguard.policy;

import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Explicit allow/deny for one tool. */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyRule {

    static final String DEFAULT_REASON = "policy rule";

    @JsonProperty("tool")
    private final ToolName toolName;

    private final boolean allowed;

    @JsonProperty("rule_id")
    private final String ruleId;

    private final String reason;
}
