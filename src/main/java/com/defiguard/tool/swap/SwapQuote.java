package com.defiguard.tool.swap;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class SwapQuote {

    @JsonProperty("input_token")
    private final String inputToken;

    @JsonProperty("output_token")
    private final String outputToken;

    @JsonProperty("input_amount")
    private final String inputAmount;

    @JsonProperty("output_amount")
    private final String outputAmount;

    @JsonProperty("price_impact_percent")
    private final BigDecimal priceImpactPercent;

    @JsonProperty("gas_estimate")
    private final long gasEstimate;

    @JsonProperty("path_id")
    private final String pathId;

    @JsonProperty("chain_id")
    private final long chainId;
}
