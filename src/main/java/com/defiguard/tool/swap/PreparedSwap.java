package com.defiguard.tool.swap;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * An unsigned swap transaction. Signing it is a separate {@code wallet_sign_tx} call,
 * governed on its own.
 */
@Getter
@Builder
@ToString
public class PreparedSwap {

    private final String to;
    private final String data;
    private final String value;

    @JsonProperty("gas_limit")
    private final long gasLimit;

    @JsonProperty("chain_id")
    private final long chainId;

    @JsonProperty("path_id")
    private final String pathId;
}
