package com.defiguard.tool.swap;

import com.defiguard.tool.ActionKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** What an {@code odos_swap} call does. Only {@link #PREPARE_SWAP} commits capital. */
public enum SwapAction {
    QUOTE("quote", ActionKind.READ_ONLY),
    PREPARE_SWAP("prepare_swap", ActionKind.CAPITAL_COMMITTING);

    private final String wireValue;
    private final ActionKind actionKind;

    SwapAction(String wireValue, ActionKind actionKind) {
        this.wireValue = wireValue;
        this.actionKind = actionKind;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public ActionKind getActionKind() {
        return actionKind;
    }

    @JsonCreator
    public static SwapAction fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(action -> action.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown swap action"));
    }
}
