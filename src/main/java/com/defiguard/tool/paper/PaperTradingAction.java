package com.defiguard.tool.paper;

import com.defiguard.tool.ActionKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** What a {@code paper_trading} call does. Simulated swaps still count against spend limits. */
public enum PaperTradingAction {
    EXECUTE_SWAP("execute_swap", ActionKind.CAPITAL_COMMITTING),
    GET_BALANCES("get_balances", ActionKind.READ_ONLY),
    GET_METRICS("get_metrics", ActionKind.READ_ONLY),
    GET_TRADES("get_trades", ActionKind.READ_ONLY);

    private final String wireValue;
    private final ActionKind actionKind;

    PaperTradingAction(String wireValue, ActionKind actionKind) {
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
    public static PaperTradingAction fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(action -> action.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown paper trading action"));
    }
}
