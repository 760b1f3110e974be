package com.defiguard.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Structured error returned to the script. {@code code} is the taxonomy category
 * (e.g. POLICY_DENIED, LIMIT_EXCEEDED); {@code reason_code} narrows it down (e.g.
 * DAILY_CAP_EXCEEDED).
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ToolCallError {

    private final String code;

    @JsonProperty("reason_code")
    private final String reasonCode;

    private final String message;

    @JsonProperty("rule_id")
    private final String ruleId;

    private final Map<String, Object> details;
}
