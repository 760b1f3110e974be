package com.defiguard.governance;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The current UTC day's committed total and trade history. Not thread-safe: owned by
 * {@link SpendLimitTracker} and only touched under its lock.
 */
class DailySpending {

    private final int historySize;
    private final Deque<SpendRecord> history = new ArrayDeque<>();
    private LocalDate date;
    private BigDecimal total = BigDecimal.ZERO;

    DailySpending(LocalDate date, int historySize) {
        this.date = date;
        this.historySize = historySize;
    }

    LocalDate getDate() {
        return date;
    }

    BigDecimal getTotal() {
        return total;
    }

    /** Clears total and history and stamps {@code today}. */
    void resetTo(LocalDate today) {
        date = today;
        total = BigDecimal.ZERO;
        history.clear();
    }

    void add(SpendRecord record) {
        total = total.add(record.getAmountUsd());
        history.addLast(record);
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    List<SpendRecord> historyCopy() {
        return List.copyOf(history);
    }
}
