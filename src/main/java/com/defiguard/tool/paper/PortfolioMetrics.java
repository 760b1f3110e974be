package com.defiguard.tool.paper;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time view of the paper portfolio. Holdings are marked at the last price seen
 * for each token, so all P&L is unrealized.
 */
@Getter
@Builder
@ToString
public class PortfolioMetrics {

    @JsonProperty("initial_balance_usd")
    private final BigDecimal initialBalanceUsd;

    @JsonProperty("current_value_usd")
    private final BigDecimal currentValueUsd;

    @JsonProperty("unrealized_pnl_usd")
    private final BigDecimal unrealizedPnlUsd;

    @JsonProperty("total_pnl_usd")
    private final BigDecimal totalPnlUsd;

    @JsonProperty("total_pnl_percent")
    private final BigDecimal totalPnlPercent;

    @JsonProperty("total_trades")
    private final long totalTrades;

    @JsonProperty("total_volume_usd")
    private final BigDecimal totalVolumeUsd;

    @JsonProperty("created_at")
    private final Instant createdAt;

    @JsonProperty("updated_at")
    private final Instant updatedAt;
}
