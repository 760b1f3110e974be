package com.defiguard.tool.data;

import com.defiguard.tool.Network;
import com.defiguard.tool.ToolArguments;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Arguments for {@code query_subgraph}. {@code pool_info} needs {@code params.pool_id},
 * {@code token_price} needs {@code params.token_address}.
 */
@Data
@NoArgsConstructor
public class SubgraphQueryArguments implements ToolArguments {

    static final String UNISWAP_V3 = "uniswap_v3";

    @NotNull(message = "is required")
    @Pattern(regexp = "^uniswap_v3$", message = "must be uniswap_v3")
    private String protocol;

    @NotNull(message = "is required")
    private String network;

    @JsonProperty("query_type")
    @NotNull(message = "is required")
    private SubgraphQueryType queryType;

    @Valid
    private SubgraphQueryParams params = new SubgraphQueryParams();

    @JsonIgnore
    @AssertTrue(message = "network must be one of ethereum, arbitrum, optimism, base")
    public boolean isKnownNetwork() {
        return network == null || Network.fromWireName(network).isPresent();
    }

    @JsonIgnore
    @AssertTrue(message = "pool_info requires params.pool_id and token_price requires params.token_address")
    public boolean isQueryParamsPresent() {
        if (queryType == SubgraphQueryType.POOL_INFO) {
            return params != null && params.getPoolId() != null;
        }
        if (queryType == SubgraphQueryType.TOKEN_PRICE) {
            return params != null && params.getTokenAddress() != null;
        }
        return true;
    }
}
