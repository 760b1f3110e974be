package com.defiguard.governance;

import com.defiguard.exception.ConfigurationException;
import java.util.Arrays;

/** What the spend tracker does with a capital-committing call whose USD value is unknown. */
public enum UnpricedTradePolicy {
    /** Admit the call; it is not counted against the caps. */
    FAIL_OPEN("fail-open"),
    /** Block the call. */
    FAIL_CLOSED("fail-closed");

    private final String wireValue;

    UnpricedTradePolicy(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * @throws ConfigurationException if {@code value} is missing or not one of the wire values
     */
    public static UnpricedTradePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(
                    "defiguard.spend.unpriced-trade-policy must be set to fail-open or fail-closed");
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(policy -> policy.wireValue.equals(trimmed))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown unpriced-trade policy '" + trimmed
                        + "' (expected fail-open or fail-closed)"));
    }
}
