package com.defiguard.wallet;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which input a transaction signature was computed from. */
public enum HashSource {
    TX_HASH("tx_hash"),
    TX_BYTES("tx_bytes");

    private final String wireValue;

    HashSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
