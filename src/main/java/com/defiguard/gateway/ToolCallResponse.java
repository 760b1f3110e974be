package com.defiguard.gateway;

import com.defiguard.tool.ToolCallStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * Terminal answer to a tool call: {@code done} with output, or {@code error}. The
 * script never receives a {@code streaming} response.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCallResponse {

    private final ToolCallStatus status;
    private final JsonNode output;
    private final ToolCallError error;

    /** Correlates with the audit record; absent for authentication failures. */
    @JsonProperty("call_id")
    private final String callId;

    private ToolCallResponse(ToolCallStatus status, JsonNode output, ToolCallError error, String callId) {
        this.status = status;
        this.output = output;
        this.error = error;
        this.callId = callId;
    }

    public static ToolCallResponse done(String callId, JsonNode output) {
        return new ToolCallResponse(ToolCallStatus.DONE, output, null, callId);
    }

    public static ToolCallResponse error(String callId, ToolCallError error) {
        return new ToolCallResponse(ToolCallStatus.ERROR, null, error, callId);
    }

    @JsonIgnore
    public boolean isDone() {
        return status == ToolCallStatus.DONE;
    }
}
