package com.defiguard.governance;

/**
 * The governance stages, in evaluation order. The pipeline sorts its interceptors by
 * this ordinal and requires exactly one per stage.
 */
public enum GovernanceStage {
    POLICY("policy"),
    SPEND_LIMIT("spend_limit"),
    SLIPPAGE("slippage"),
    COOLDOWN("cooldown");

    private final String label;

    GovernanceStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
