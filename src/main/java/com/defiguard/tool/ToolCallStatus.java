package com.defiguard.tool;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * States of a single tool-call exchange: SENT -> (STREAMING)* -> DONE | ERROR.
 */
public enum ToolCallStatus {
    SENT,
    STREAMING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
