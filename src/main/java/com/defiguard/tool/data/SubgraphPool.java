package com.defiguard.tool.data;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A liquidity pool as indexed by the protocol's subgraph. Prices are token1 per token0 and back. */
@Getter
@Builder
@ToString
public class SubgraphPool {

    private final String id;
    private final SubgraphToken token0;
    private final SubgraphToken token1;

    @JsonProperty("fee_tier")
    private final int feeTier;

    @JsonProperty("token0_price")
    private final BigDecimal token0Price;

    @JsonProperty("token1_price")
    private final BigDecimal token1Price;

    @JsonProperty("volume_usd")
    private final BigDecimal volumeUsd;

    @JsonProperty("total_value_locked_usd")
    private final BigDecimal totalValueLockedUsd;

    @JsonProperty("tx_count")
    private final long txCount;
}
