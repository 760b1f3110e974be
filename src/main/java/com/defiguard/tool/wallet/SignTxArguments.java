package com.defiguard.tool.wallet;

import com.defiguard.tool.ToolArguments;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Exactly one of {@code tx_hash} (32-byte digest) or {@code tx_bytes} (raw transaction,
 * hashed with Keccak-256 before signing) must be supplied.
 */
@Data
@NoArgsConstructor
public class SignTxArguments implements ToolArguments {

    @JsonProperty("tx_hash")
    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "must be a 0x-prefixed 32-byte hex string")
    private String txHash;

    @JsonProperty("tx_bytes")
    @Pattern(regexp = "^0x([0-9a-fA-F]{2})+$", message = "must be a non-empty 0x-prefixed hex string")
    @ToString.Exclude
    private String txBytes;

    @JsonIgnore
    @AssertTrue(message = "exactly one of tx_hash or tx_bytes is required")
    public boolean isSingleSource() {
        return (txHash == null) != (txBytes == null);
    }
}
