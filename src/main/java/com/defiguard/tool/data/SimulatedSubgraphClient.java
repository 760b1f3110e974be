package com.defiguard.tool.data;

import com.defiguard.tool.Network;
import com.defiguard.wallet.HexCodec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;

/**
 * Simulated {@link SubgraphClient} over a fixed catalog of major Uniswap v3 pairs on each
 * supported network. Token addresses are the real deployments; pool ids, liquidity and
 * volume are deterministic stand-ins. ETH is priced at a constant, stablecoins at 1 USD.
 */
@Service
public class SimulatedSubgraphClient implements SubgraphClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSubgraphClient.class);

    static final BigDecimal ETH_PRICE_USD = new BigDecimal("3000");

    private static final BigDecimal VOLUME_RATIO = new BigDecimal("0.35");

    private final Map<Network, Map<String, SubgraphToken>> tokens = new EnumMap<>(Network.class);
    private final Map<Network, Map<String, BigDecimal>> pricesUsd = new EnumMap<>(Network.class);
    private final Map<Network, List<SubgraphPool>> pools = new EnumMap<>(Network.class);

    public SimulatedSubgraphClient() {
        register(Network.ETHEREUM, new BigDecimal("1.0"),
                "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48",
                "0xdac17f958d2ee523a2206206994597c13d831ec7",
                "0x6b175474e89094c44da98b954eedeac495271d0f",
                "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2");
        register(Network.ARBITRUM, new BigDecimal("0.4"),
                "0xaf88d065e77c8cc2239327c5edb3a432268e5831",
                "0xfd086bc7cd5c481dcc9c85ebe478a1c0b69fcbb9",
                "0xda10009cbd5d07dd0cecc66161fc93d7c9000da1",
                "0x82af49447d8a07e3bd95bd0d56f35241523fbab1");
        register(Network.OPTIMISM, new BigDecimal("0.15"),
                "0x0b2c639c533813f4aa9d7837caf62653d097ff85",
                "0x94b008aa00579c1307b0ef2c499ad98a8ce58e58",
                null,
                "0x4200000000000000000000000000000000000006");
        register(Network.BASE, new BigDecimal("0.3"),
                "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913",
                null,
                "0x50c5725949a6f0c72e6c4a641f24049a917db0cb",
                "0x4200000000000000000000000000000000000006");
    }

    @Override
    public List<SubgraphPool> topPools(Network network, int limit) {
        List<SubgraphPool> result = pools.get(network).stream()
                .limit(limit)
                .collect(Collectors.toList());
        log.debug("Simulated top pools [network={}, limit={}, returned={}]",
                network.getWireName(), limit, result.size());
        return result;
    }

    @Override
    public Optional<SubgraphPool> pool(Network network, String poolId) {
        String id = poolId.toLowerCase(Locale.ROOT);
        return pools.get(network).stream()
                .filter(pool -> pool.getId().equals(id))
                .findFirst();
    }

    @Override
    public Optional<TokenPrice> tokenPrice(Network network, String tokenAddress) {
        String id = tokenAddress.toLowerCase(Locale.ROOT);
        SubgraphToken token = tokens.get(network).get(id);
        if (token == null) {
            return Optional.empty();
        }
        return Optional.of(TokenPrice.builder()
                .token(token)
                .priceUsd(pricesUsd.get(network).get(id))
                .build());
    }

    @Override
    public BigDecimal ethPriceUsd(Network network) {
        return ETH_PRICE_USD;
    }

    // ========================
    // CATALOG
    // ========================

    private void register(Network network, BigDecimal scale, String usdc, String usdt, String dai, String weth) {
        Map<String, SubgraphToken> networkTokens = new LinkedHashMap<>();
        Map<String, BigDecimal> networkPrices = new LinkedHashMap<>();
        addToken(networkTokens, networkPrices, usdc, "USDC", "USD Coin", 6, BigDecimal.ONE);
        addToken(networkTokens, networkPrices, usdt, "USDT", "Tether USD", 6, BigDecimal.ONE);
        addToken(networkTokens, networkPrices, dai, "DAI", "Dai Stablecoin", 18, BigDecimal.ONE);
        addToken(networkTokens, networkPrices, weth, "WETH", "Wrapped Ether", 18, ETH_PRICE_USD);
        tokens.put(network, networkTokens);
        pricesUsd.put(network, networkPrices);

        List<SubgraphPool> networkPools = new ArrayList<>();
        addPool(networkPools, network, networkTokens, networkPrices, usdc, weth, 500, "180000000", scale);
        addPool(networkPools, network, networkTokens, networkPrices, usdc, weth, 3000, "95000000", scale);
        addPool(networkPools, network, networkTokens, networkPrices, weth, usdt, 3000, "70000000", scale);
        addPool(networkPools, network, networkTokens, networkPrices, dai, usdc, 100, "60000000", scale);
        addPool(networkPools, network, networkTokens, networkPrices, dai, weth, 3000, "25000000", scale);
        networkPools.sort(Comparator.comparing(SubgraphPool::getTotalValueLockedUsd).reversed());
        pools.put(network, List.copyOf(networkPools));
    }

    private static void addToken(
            Map<String, SubgraphToken> networkTokens,
            Map<String, BigDecimal> networkPrices,
            String address,
            String symbol,
            String name,
            int decimals,
            BigDecimal priceUsd) {
        if (address == null) {
            return;
        }
        networkTokens.put(address, SubgraphToken.builder()
                .id(address)
                .symbol(symbol)
                .name(name)
                .decimals(decimals)
                .build());
        networkPrices.put(address, priceUsd);
    }

    private static void addPool(
            List<SubgraphPool> networkPools,
            Network network,
            Map<String, SubgraphToken> networkTokens,
            Map<String, BigDecimal> networkPrices,
            String token0,
            String token1,
            int feeTier,
            String baseTvlUsd,
            BigDecimal scale) {
        if (token0 == null || token1 == null) {
            return;
        }
        BigDecimal price0 = networkPrices.get(token0);
        BigDecimal price1 = networkPrices.get(token1);
        BigDecimal tvl = new BigDecimal(baseTvlUsd).multiply(scale).setScale(2, RoundingMode.HALF_EVEN);
        networkPools.add(SubgraphPool.builder()
                .id(poolId(network, token0, token1, feeTier))
                .token0(networkTokens.get(token0))
                .token1(networkTokens.get(token1))
                .feeTier(feeTier)
                .token0Price(price0.divide(price1, 8, RoundingMode.HALF_EVEN).stripTrailingZeros())
                .token1Price(price1.divide(price0, 8, RoundingMode.HALF_EVEN).stripTrailingZeros())
                .volumeUsd(tvl.multiply(VOLUME_RATIO).setScale(2, RoundingMode.HALF_EVEN))
                .totalValueLockedUsd(tvl)
                .txCount(tvl.movePointLeft(3).longValue())
                .build());
    }

    /** Last 20 bytes of keccak(chainId:token0:token1:fee), shaped like a pool address. */
    private static String poolId(Network network, String token0, String token1, int feeTier) {
        String key = network.getChainId() + ":" + token0 + ":" + token1 + ":" + feeTier;
        String hash = HexCodec.encode(Hash.sha3(key.getBytes(StandardCharsets.UTF_8)));
        return "0x" + hash.substring(hash.length() - 40);
    }
}
