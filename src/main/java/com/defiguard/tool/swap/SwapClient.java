package com.defiguard.tool.swap;

/**
 * Backend for {@code odos_swap}. The tool only ever talks to an aggregator through this
 * interface.
 *
 * <p>Implementations must bound their own latency; a timeout should surface as a
 * {@link com.defiguard.exception.ToolExecutionException}. Nothing here signs or
 * broadcasts a transaction.
 */
public interface SwapClient {

    /**
     * Prices a swap without committing to it.
     *
     * @throws com.defiguard.exception.ToolExecutionException if the backend fails or has no route
     */
    SwapQuote quote(SwapRequest request);

    /**
     * Builds the unsigned transaction for a previously obtained quote.
     *
     * @throws com.defiguard.exception.ToolExecutionException if the backend fails
     */
    PreparedSwap prepare(SwapRequest request, SwapQuote quote);
}
