package com.defiguard.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** What the sandboxed script sends across the bridge. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRequest {

    @JsonProperty("tool_name")
    private String toolName;

    @ToString.Exclude
    private JsonNode args;

    @JsonProperty("invocation_token")
    @ToString.Exclude
    private String invocationToken;
}
