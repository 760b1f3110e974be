package com.defiguard.tool.swap;

import com.defiguard.tool.Network;
import java.math.BigDecimal;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Normalized swap parameters handed to a {@link SwapClient}. */
@Getter
@Builder
@ToString
public class SwapRequest {

    private final Network network;
    private final String inputToken;
    private final String outputToken;
    private final BigInteger amount;
    private final BigDecimal slippagePercent;
    /** Address the prepared transaction will be sent from. */
    private final String signer;
}
