package com.defiguard.tool.data;

import com.defiguard.tool.Network;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to indexed Uniswap v3 data. {@code query_subgraph} only reaches an
 * indexer through this interface.
 *
 * <p>Implementations must bound their own latency and surface backend failures as
 * {@link com.defiguard.exception.ToolExecutionException}.
 */
public interface SubgraphClient {

    /** Pools on {@code network} ordered by total value locked, largest first. */
    List<SubgraphPool> topPools(Network network, int limit);

    Optional<SubgraphPool> pool(Network network, String poolId);

    /** Empty when the token is not indexed on {@code network}. */
    Optional<TokenPrice> tokenPrice(Network network, String tokenAddress);

    /** ETH price the indexer currently uses to derive USD values. */
    BigDecimal ethPriceUsd(Network network);
}
