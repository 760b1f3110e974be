package com.defiguard.governance;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time copy of the tracker's state, taken under its lock. */
@Getter
@Builder
public class SpendSnapshot {

    private final LocalDate date;
    private final BigDecimal committedUsd;
    private final BigDecimal pendingUsd;
    private final BigDecimal remainingUsd;
    private final BigDecimal maxDailyUsd;
    private final BigDecimal maxPerTradeUsd;
    private final int pendingCount;
    private final List<SpendRecord> history;
}
