package com.defiguard.tool.paper;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.exception.ToolExecutionException;
import com.defiguard.tool.Network;
import com.defiguard.tool.TradeValueEstimator;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory portfolio behind {@code paper_trading}. Starts as a single USDC holding
 * worth the configured initial balance and only ever changes through
 * {@link #executeSwap}. Nothing here touches a chain.
 *
 * <p>Token amounts are base units. Holdings are valued at the last USD price a swap
 * reported for the token; a token never priced counts as zero. State lives for the
 * lifetime of the process.
 */
@Component
public class PaperPortfolio {

    private static final Logger log = LoggerFactory.getLogger(PaperPortfolio.class);

    static final String INITIAL_TOKEN = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"; // USDC, ethereum
    private static final int INITIAL_TOKEN_DECIMALS = 6;
    private static final int DEFAULT_DECIMALS = 18;
    private static final int MAX_TRADES = 1000;
    private static final int USD_SCALE = 6;

    private final TradeValueEstimator tradeValueEstimator;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final BigDecimal initialBalanceUsd;
    private final Map<String, BigInteger> holdings = new LinkedHashMap<>();
    private final Map<String, BigDecimal> pricesUsd = new LinkedHashMap<>();
    private final Deque<PaperTrade> trades = new ArrayDeque<>();
    private long totalTrades;
    private BigDecimal totalVolumeUsd = BigDecimal.ZERO;
    private final Instant createdAt;
    private Instant updatedAt;

    public PaperPortfolio(
            @Value("${defiguard.paper.initial-balance-usd:10000}") BigDecimal initialBalanceUsd,
            TradeValueEstimator tradeValueEstimator,
            Clock clock) {
        if (initialBalanceUsd == null || initialBalanceUsd.signum() < 0) {
            throw new ConfigurationException("defiguard.paper.initial-balance-usd must not be negative");
        }
        this.initialBalanceUsd = initialBalanceUsd;
        this.tradeValueEstimator = tradeValueEstimator;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;

        BigInteger initialUnits = initialBalanceUsd.movePointRight(INITIAL_TOKEN_DECIMALS)
                .setScale(0, RoundingMode.DOWN)
                .toBigInteger();
        if (initialUnits.signum() > 0) {
            holdings.put(INITIAL_TOKEN, initialUnits);
        }
        pricesUsd.put(INITIAL_TOKEN, BigDecimal.ONE);
        log.info("Paper portfolio opened with {} USD in USDC", initialBalanceUsd.toPlainString());
    }

    // ========================
    // TRADING
    // ========================

    /**
     * Swaps {@code inputAmount} of {@code inputToken} for {@code outputAmount} of
     * {@code outputToken} at the given prices.
     *
     * @param tradeValueUsd governance valuation of the trade; when null the input is
     *                      valued at {@code inputPriceUsd}
     * @throws ToolExecutionException if the portfolio holds less than {@code inputAmount}
     */
    public PaperTrade executeSwap(
            String inputToken,
            String outputToken,
            BigInteger inputAmount,
            BigInteger outputAmount,
            BigDecimal inputPriceUsd,
            BigDecimal outputPriceUsd,
            BigDecimal tradeValueUsd,
            Network network) {
        String in = normalize(inputToken);
        String out = normalize(outputToken);

        lock.lock();
        try {
            BigInteger held = holdings.getOrDefault(in, BigInteger.ZERO);
            if (held.compareTo(inputAmount) < 0) {
                throw new ToolExecutionException(
                        "Insufficient balance: have " + held + " but need " + inputAmount);
            }

            BigInteger remaining = held.subtract(inputAmount);
            if (remaining.signum() == 0) {
                holdings.remove(in);
            } else {
                holdings.put(in, remaining);
            }
            holdings.merge(out, outputAmount, BigInteger::add);
            pricesUsd.put(in, inputPriceUsd);
            pricesUsd.put(out, outputPriceUsd);

            BigDecimal value = tradeValueUsd != null ? tradeValueUsd : valueOf(in, inputAmount, inputPriceUsd);
            Instant now = clock.instant();
            PaperTrade trade = PaperTrade.builder()
                    .timestamp(now)
                    .inputToken(in)
                    .outputToken(out)
                    .inputAmount(inputAmount.toString())
                    .outputAmount(outputAmount.toString())
                    .tradeValueUsd(value)
                    .chainId(network.getChainId())
                    .build();

            trades.addFirst(trade);
            if (trades.size() > MAX_TRADES) {
                trades.removeLast();
            }
            totalTrades++;
            totalVolumeUsd = totalVolumeUsd.add(value);
            updatedAt = now;

            log.info("Paper swap executed [{} -> {}, valueUsd={}, trades={}]",
                    in, out, value.toPlainString(), totalTrades);
            return trade;
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // QUERIES
    // ========================

    public List<PaperBalance> balances() {
        lock.lock();
        try {
            List<PaperBalance> result = new ArrayList<>(holdings.size());
            holdings.forEach((token, units) -> {
                int decimals = decimalsOf(token);
                result.add(PaperBalance.builder()
                        .token(token)
                        .balanceRaw(units.toString())
                        .balanceFormatted(new BigDecimal(units, decimals).stripTrailingZeros().toPlainString())
                        .decimals(decimals)
                        .build());
            });
            return result;
        } finally {
            lock.unlock();
        }
    }

    public PortfolioMetrics metrics() {
        lock.lock();
        try {
            BigDecimal current = BigDecimal.ZERO;
            for (Map.Entry<String, BigInteger> holding : holdings.entrySet()) {
                BigDecimal price = pricesUsd.get(holding.getKey());
                if (price != null) {
                    current = current.add(valueOf(holding.getKey(), holding.getValue(), price));
                }
            }
            BigDecimal pnl = current.subtract(initialBalanceUsd);
            BigDecimal pnlPercent = initialBalanceUsd.signum() > 0
                    ? pnl.multiply(BigDecimal.valueOf(100)).divide(initialBalanceUsd, 4, RoundingMode.HALF_EVEN)
                    : BigDecimal.ZERO;

            return PortfolioMetrics.builder()
                    .initialBalanceUsd(initialBalanceUsd)
                    .currentValueUsd(current)
                    .unrealizedPnlUsd(pnl)
                    .totalPnlUsd(pnl)
                    .totalPnlPercent(pnlPercent)
                    .totalTrades(totalTrades)
                    .totalVolumeUsd(totalVolumeUsd)
                    .createdAt(createdAt)
                    .updatedAt(updatedAt)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /** Most recent first. A null limit returns every retained trade. */
    public List<PaperTrade> trades(Integer limit) {
        lock.lock();
        try {
            int max = limit != null ? Math.min(limit, trades.size()) : trades.size();
            List<PaperTrade> result = new ArrayList<>(max);
            Iterator<PaperTrade> it = trades.iterator();
            while (it.hasNext() && result.size() < max) {
                result.add(it.next());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private BigDecimal valueOf(String token, BigInteger units, BigDecimal priceUsd) {
        return new BigDecimal(units, decimalsOf(token))
                .multiply(priceUsd)
                .setScale(USD_SCALE, RoundingMode.HALF_EVEN)
                .stripTrailingZeros();
    }

    private int decimalsOf(String token) {
        if (INITIAL_TOKEN.equals(token)) {
            return INITIAL_TOKEN_DECIMALS;
        }
        return tradeValueEstimator.decimalsOf(token).orElse(DEFAULT_DECIMALS);
    }

    private static String normalize(String token) {
        return token.toLowerCase(Locale.ROOT);
    }
}
