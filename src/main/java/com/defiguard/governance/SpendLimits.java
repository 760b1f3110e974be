package com.defiguard.governance;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** USD caps for capital-committing calls. */
@Getter
@Builder
@ToString
public class SpendLimits {

    static final int DEFAULT_HISTORY_SIZE = 1000;

    private final BigDecimal maxPerTradeUsd;
    private final BigDecimal maxDailyUsd;
    private final UnpricedTradePolicy unpricedTradePolicy;

    /** Trades kept in the current day's history; older entries are dropped first. */
    @Builder.Default
    private final int historySize = DEFAULT_HISTORY_SIZE;
}
