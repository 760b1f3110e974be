package com.defiguard.tool.paper;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PaperBalance {

    private final String token;

    @JsonProperty("balance_raw")
    private final String balanceRaw;

    @JsonProperty("balance_formatted")
    private final String balanceFormatted;

    private final int decimals;
}
