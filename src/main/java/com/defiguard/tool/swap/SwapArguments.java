package com.defiguard.tool.swap;

import com.defiguard.tool.Network;
import com.defiguard.tool.ToolArguments;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Arguments for {@code odos_swap}.
 *
 * <p>{@code amount} is in the input token's smallest unit. {@code amount_usd} is the
 * caller's own USD valuation, accepted only for tokens the host cannot price itself;
 * stablecoin inputs are always valued from {@code amount}.
 * {@code price_impact_percent} is the impact reported by an earlier quote; the impact
 * of the quote fetched while preparing is checked as well.
 */
@Data
@NoArgsConstructor
public class SwapArguments implements ToolArguments {

    private static final String ADDRESS = "^0x[0-9a-fA-F]{40}$";

    @NotNull(message = "is required")
    private SwapAction action;

    @JsonProperty("input_token")
    @NotNull(message = "is required")
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String inputToken;

    @JsonProperty("output_token")
    @NotNull(message = "is required")
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String outputToken;

    @NotNull(message = "is required")
    @Pattern(regexp = "^[1-9][0-9]{0,77}$", message = "must be a positive integer in base units")
    private String amount;

    @JsonProperty("amount_usd")
    @DecimalMin(value = "0", message = "must not be negative")
    private BigDecimal amountUsd;

    @JsonProperty("slippage_percent")
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    @DecimalMax(value = "50", message = "must be at most 50")
    private BigDecimal slippagePercent;

    @JsonProperty("price_impact_percent")
    @DecimalMin(value = "0", message = "must not be negative")
    private BigDecimal priceImpactPercent;

    private String network;

    @JsonIgnore
    @AssertTrue(message = "network must be one of ethereum, arbitrum, optimism, base")
    public boolean isKnownNetwork() {
        return network == null || Network.fromWireName(network).isPresent();
    }

    @JsonIgnore
    @AssertTrue(message = "input_token and output_token must differ")
    public boolean isDistinctPair() {
        return inputToken == null || outputToken == null || !inputToken.equalsIgnoreCase(outputToken);
    }
}
