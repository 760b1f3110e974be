package com.defiguard.policy;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** What the policy engine does with a tool that has no explicit rule. */
public enum PolicyMode {
    DEFAULT_ALLOW("default-allow"),
    DEFAULT_DENY("default-deny");

    private final String wireValue;

    PolicyMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public static Optional<PolicyMode> fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.wireValue.equals(value))
                .findFirst();
    }
}
