package com.defiguard.tool.paper;

import com.defiguard.tool.Network;
import com.defiguard.tool.ToolArguments;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Arguments for {@code paper_trading}. The swap fields are only read by
 * {@code execute_swap}, where all of them are required; amounts are in base units.
 */
@Data
@NoArgsConstructor
public class PaperTradingArguments implements ToolArguments {

    private static final String ADDRESS = "^0x[0-9a-fA-F]{40}$";
    private static final String BASE_UNITS = "^[1-9][0-9]{0,77}$";

    @NotNull(message = "is required")
    private PaperTradingAction action;

    @JsonProperty("input_token")
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String inputToken;

    @JsonProperty("output_token")
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String outputToken;

    @JsonProperty("input_amount")
    @Pattern(regexp = BASE_UNITS, message = "must be a positive integer in base units")
    private String inputAmount;

    @JsonProperty("expected_output")
    @Pattern(regexp = BASE_UNITS, message = "must be a positive integer in base units")
    private String expectedOutput;

    @JsonProperty("input_price_usd")
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    private BigDecimal inputPriceUsd;

    @JsonProperty("output_price_usd")
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    private BigDecimal outputPriceUsd;

    private String network;

    @Min(value = 1, message = "must be at least 1")
    @Max(value = 1000, message = "must be at most 1000")
    private Integer limit;

    @JsonIgnore
    @AssertTrue(message = "network must be one of ethereum, arbitrum, optimism, base")
    public boolean isKnownNetwork() {
        return network == null || Network.fromWireName(network).isPresent();
    }

    @JsonIgnore
    @AssertTrue(message = "execute_swap requires input_token, output_token, input_amount, expected_output, "
            + "input_price_usd and output_price_usd")
    public boolean isSwapFieldsPresent() {
        return action != PaperTradingAction.EXECUTE_SWAP
                || (inputToken != null && outputToken != null && inputAmount != null && expectedOutput != null
                        && inputPriceUsd != null && outputPriceUsd != null);
    }

    @JsonIgnore
    @AssertTrue(message = "input_token and output_token must differ")
    public boolean isDistinctPair() {
        return inputToken == null || outputToken == null || !inputToken.equalsIgnoreCase(outputToken);
    }
}
