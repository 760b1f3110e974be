package com.defiguard.tool.data;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class TokenPrice {

    private final SubgraphToken token;

    @JsonProperty("price_usd")
    private final BigDecimal priceUsd;
}
