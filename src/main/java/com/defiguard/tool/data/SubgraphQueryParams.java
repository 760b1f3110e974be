package com.defiguard.tool.data;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-query parameters of {@code query_subgraph}. */
@Data
@NoArgsConstructor
public class SubgraphQueryParams {

    private static final String ADDRESS = "^0x[0-9a-fA-F]{40}$";

    /** Number of pools for {@code top_pools}; defaults to 10. */
    @Min(value = 1, message = "must be at least 1")
    @Max(value = 100, message = "must be at most 100")
    private Integer limit;

    @JsonProperty("pool_id")
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String poolId;

    @JsonProperty("token_address")
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String tokenAddress;
}
