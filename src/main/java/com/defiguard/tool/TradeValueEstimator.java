package com.defiguard.tool;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Estimates the USD value of a trade from its arguments.
 *
 * <p>Priority:
 * <ol>
 *   <li>For well-known stablecoins, {@code amount / 10^decimals} at 1:1 USD. A value
 *       declared by the caller is ignored for these tokens</li>
 *   <li>For any other token, the caller's declared USD value</li>
 *   <li>Otherwise unknown: callers apply the configured unpriced-trade policy</li>
 * </ol>
 *
 * <p>Pure in-process lookup, no price feed, so it can never stall a governance check.
 */
@Component
public class TradeValueEstimator {

    private static final Logger log = LoggerFactory.getLogger(TradeValueEstimator.class);

    /** Stablecoin contract address (lowercase) -> decimals. */
    static final Map<String, Integer> STABLECOIN_DECIMALS = Map.ofEntries(
            // Ethereum mainnet
            Map.entry("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", 6), // USDC
            Map.entry("0xdac17f958d2ee523a2206206994597c13d831ec7", 6), // USDT
            Map.entry("0x6b175474e89094c44da98b954eedeac495271d0f", 18), // DAI
            // Arbitrum
            Map.entry("0xaf88d065e77c8cc2239327c5edb3a432268e5831", 6), // USDC
            Map.entry("0xff970a61a04b1ca14834a43f5de4533ebddb5cc8", 6), // USDC.e
            Map.entry("0xfd086bc7cd5c481dcc9c85ebe478a1c0b69fcbb9", 6), // USDT
            Map.entry("0xda10009cbd5d07dd0cecc66161fc93d7c9000da1", 18), // DAI
            // Optimism
            Map.entry("0x0b2c639c533813f4aa9d7837caf62653d097ff85", 6), // USDC
            Map.entry("0x7f5c764cbc14f9669b88837ca1490cca17c31607", 6), // USDC.e
            Map.entry("0x94b008aa00579c1307b0ef2c499ad98a8ce58e58", 6), // USDT
            // Base
            Map.entry("0x833589fcd6edb6e08f4c7c32d4f71b54bda02913", 6), // USDC
            Map.entry("0x50c5725949a6f0c72e6c4a641f24049a917db0cb", 18)); // DAI

    /** Non-stable tokens whose decimals are known but whose price is not. */
    static final Map<String, Integer> OTHER_DECIMALS = Map.of(
            "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2", 18, // WETH ethereum
            "0x82af49447d8a07e3bd95bd0d56f35241523fbab1", 18, // WETH arbitrum
            "0x4200000000000000000000000000000000000006", 18, // WETH optimism, base
            "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee", 18, // native sentinel
            "0x0000000000000000000000000000000000000000", 18); // native

    /**
     * @param declaredUsd USD value declared by the caller, may be null; only used when
     *                    the token cannot be priced here
     * @param inputToken  input token address
     * @param baseUnits   input amount in the token's smallest unit, decimal string
     * @return the USD value, or empty when it cannot be determined
     */
    public Optional<BigDecimal> estimateUsd(BigDecimal declaredUsd, String inputToken, String baseUnits) {
        Optional<BigDecimal> stableValue = stablecoinValue(inputToken, baseUnits);
        if (stableValue.isPresent()) {
            if (declaredUsd != null && declaredUsd.compareTo(stableValue.get()) != 0) {
                log.warn("Ignoring declared amount_usd={} for stablecoin {}; valued at {} USD",
                        declaredUsd, inputToken, stableValue.get());
            }
            return stableValue;
        }
        if (declaredUsd != null) {
            log.debug("Using declared amount_usd={} for {}", declaredUsd, inputToken);
            return Optional.of(declaredUsd);
        }
        log.warn("Cannot determine USD value for token {} without a price feed; pass amount_usd for accurate "
                + "limit enforcement", inputToken);
        return Optional.empty();
    }

    /** Decimals of a token known to this estimator, stablecoin or not. */
    public Optional<Integer> decimalsOf(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String key = token.toLowerCase(Locale.ROOT);
        Integer decimals = STABLECOIN_DECIMALS.get(key);
        return Optional.ofNullable(decimals != null ? decimals : OTHER_DECIMALS.get(key));
    }

    private static Optional<BigDecimal> stablecoinValue(String inputToken, String baseUnits) {
        if (inputToken == null || baseUnits == null) {
            return Optional.empty();
        }
        Integer decimals = STABLECOIN_DECIMALS.get(inputToken.toLowerCase(Locale.ROOT));
        if (decimals == null) {
            return Optional.empty();
        }
        BigInteger units;
        try {
            units = new BigInteger(baseUnits);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(units, decimals).stripTrailingZeros());
    }
}
