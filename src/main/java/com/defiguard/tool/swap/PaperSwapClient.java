package com.defiguard.tool.swap;

import com.defiguard.tool.Network;
import com.defiguard.wallet.HexCodec;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;

/**
 * Simulated {@link SwapClient} for paper trading. Quotes are deterministic functions of
 * the request: a flat 0.3% fee plus a small size-dependent price impact. Prepared
 * transactions target the aggregator router but are never sent anywhere.
 */
@Service
public class PaperSwapClient implements SwapClient {

    private static final Logger log = LoggerFactory.getLogger(PaperSwapClient.class);

    /** Aggregator router (v2), same address on every supported chain. */
    static final String ROUTER_ADDRESS = "0xCf5540fFFCdC3d510B18bFcA6d2b9987b0772559";

    private static final BigDecimal FEE_MULTIPLIER = new BigDecimal("0.997");
    private static final BigDecimal BASE_PRICE_IMPACT = new BigDecimal("0.05");
    private static final long GAS_ESTIMATE = 180_000L;
    private static final long GAS_LIMIT = 250_000L;

    @Override
    public SwapQuote quote(SwapRequest request) {
        BigDecimal impact = priceImpact(request.getAmount());
        BigDecimal retained = FEE_MULTIPLIER.multiply(
                BigDecimal.ONE.subtract(impact.movePointLeft(2)));
        BigInteger outputAmount = new BigDecimal(request.getAmount())
                .multiply(retained)
                .setScale(0, RoundingMode.DOWN)
                .toBigInteger();

        SwapQuote quote = SwapQuote.builder()
                .inputToken(request.getInputToken())
                .outputToken(request.getOutputToken())
                .inputAmount(request.getAmount().toString())
                .outputAmount(outputAmount.toString())
                .priceImpactPercent(impact)
                .gasEstimate(GAS_ESTIMATE)
                .pathId(pathId(request))
                .chainId(request.getNetwork().getChainId())
                .build();
        log.debug("Paper quote [network={}, pathId={}, impact={}]",
                request.getNetwork().getWireName(), quote.getPathId(), impact);
        return quote;
    }

    @Override
    public PreparedSwap prepare(SwapRequest request, SwapQuote quote) {
        // calldata stand-in: keccak(pathId || signer), enough to make each prepared tx distinct
        byte[] calldata = Hash.sha3((quote.getPathId() + request.getSigner()).getBytes(StandardCharsets.UTF_8));
        PreparedSwap prepared = PreparedSwap.builder()
                .to(ROUTER_ADDRESS)
                .data(HexCodec.encode(calldata))
                .value(isNative(request.getInputToken()) ? request.getAmount().toString() : "0")
                .gasLimit(GAS_LIMIT)
                .chainId(request.getNetwork().getChainId())
                .pathId(quote.getPathId())
                .build();
        log.info("Paper swap prepared [network={}, pathId={}]",
                request.getNetwork().getWireName(), prepared.getPathId());
        return prepared;
    }

    /** 0.05% plus 0.01% per order of magnitude above 10^18 base units. */
    private static BigDecimal priceImpact(BigInteger amount) {
        int extraDigits = Math.max(0, amount.toString().length() - 19);
        return BASE_PRICE_IMPACT.add(new BigDecimal("0.01").multiply(BigDecimal.valueOf(extraDigits)));
    }

    private static String pathId(SwapRequest request) {
        Network network = request.getNetwork();
        String key = network.getChainId() + ":" + request.getInputToken().toLowerCase(Locale.ROOT) + ":"
                + request.getOutputToken().toLowerCase(Locale.ROOT) + ":" + request.getAmount();
        return HexCodec.encode(Hash.sha3(key.getBytes(StandardCharsets.UTF_8))).substring(2, 34);
    }

    private static boolean isNative(String token) {
        return "0x0000000000000000000000000000000000000000".equals(token)
                || "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee".equalsIgnoreCase(token);
    }
}
