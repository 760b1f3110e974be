package com.defiguard.tool.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum SubgraphQueryType {
    TOP_POOLS("top_pools"),
    POOL_INFO("pool_info"),
    TOKEN_PRICE("token_price");

    private final String wireValue;

    SubgraphQueryType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static SubgraphQueryType fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown query type"));
    }
}
