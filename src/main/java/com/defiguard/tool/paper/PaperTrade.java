package com.defiguard.tool.paper;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** One simulated swap, as recorded by {@link PaperPortfolio}. */
@Getter
@Builder
@ToString
public class PaperTrade {

    private final Instant timestamp;

    @JsonProperty("input_token")
    private final String inputToken;

    @JsonProperty("output_token")
    private final String outputToken;

    @JsonProperty("input_amount")
    private final String inputAmount;

    @JsonProperty("output_amount")
    private final String outputAmount;

    @JsonProperty("trade_value_usd")
    private final BigDecimal tradeValueUsd;

    @JsonProperty("chain_id")
    private final long chainId;
}
