package com.defiguard.tool;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One step returned by {@link ToolExchange#advance()}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ToolStep {

    private final ToolCallStatus status;
    private final JsonNode output;
    private final String errorMessage;

    public static ToolStep streaming(JsonNode partial) {
        return new ToolStep(ToolCallStatus.STREAMING, partial, null);
    }

    public static ToolStep done(JsonNode output) {
        return new ToolStep(ToolCallStatus.DONE, output, null);
    }

    public static ToolStep error(String message) {
        return new ToolStep(ToolCallStatus.ERROR, null, message);
    }
}
