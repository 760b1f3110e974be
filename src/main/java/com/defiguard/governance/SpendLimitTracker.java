package com.defiguard.governance;

import com.defiguard.tool.ToolCallContext;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 2: per-trade and daily USD caps for capital-committing calls.
 *
 * <p>Check and update are split into reserve and confirm so concurrent calls cannot both
 * pass a check that only one of them fits under:
 * <ol>
 *   <li>{@link #decide} checks {@code committed + pending + value <= maxDaily} and, if it
 *       fits, reserves {@code value} for the call id</li>
 *   <li>{@link #record} moves the reservation into the day's committed total</li>
 *   <li>{@link #release} drops the reservation</li>
 * </ol>
 * All three run under one {@link ReentrantLock}, so {@code committed + pending} never
 * exceeds the daily cap.
 *
 * <p>Days are UTC calendar dates read from the injected {@link Clock}. The first call
 * on a new date clears the committed total and history before anything else happens.
 * Reservations taken before midnight stay pending and count toward the day they are
 * confirmed in.
 *
 * <p>Read-only calls return Allow without touching any state.
 */
public class SpendLimitTracker implements ToolCallInterceptor {

    private static final Logger log = LoggerFactory.getLogger(SpendLimitTracker.class);

    static final String PER_TRADE_CAP_EXCEEDED = "PER_TRADE_CAP_EXCEEDED";
    static final String DAILY_CAP_EXCEEDED = "DAILY_CAP_EXCEEDED";
    static final String UNPRICED_TRADE = "UNPRICED_TRADE";

    private final SpendLimits limits;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final DailySpending spending;
    private final Map<String, Reservation> pending = new HashMap<>();

    public SpendLimitTracker(SpendLimits limits, Clock clock) {
        this.limits = limits;
        this.clock = clock;
        this.spending = new DailySpending(today(), limits.getHistorySize());
    }

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.SPEND_LIMIT;
    }

    // ========================
    // RESERVE
    // ========================

    @Override
    public InterceptorDecision decide(ToolCallContext context) {
        if (!context.isCapitalCommitting()) {
            return InterceptorDecision.allow();
        }

        Optional<BigDecimal> tradeValue = context.getTradeValue();
        if (tradeValue.isEmpty()) {
            return decideUnpriced(context);
        }
        BigDecimal value = tradeValue.get();

        lock.lock();
        try {
            resetDailyTotalIfNeeded();

            if (value.compareTo(limits.getMaxPerTradeUsd()) > 0) {
                return InterceptorDecision.limitExceeded(
                        PER_TRADE_CAP_EXCEEDED,
                        "per-trade cap exceeded: trade " + plain(value) + " USD > limit "
                                + plain(limits.getMaxPerTradeUsd()) + " USD",
                        details("per_trade", limits.getMaxPerTradeUsd(), value));
            }

            BigDecimal pendingTotal = pendingTotal();
            BigDecimal projected = spending.getTotal().add(pendingTotal).add(value);
            if (projected.compareTo(limits.getMaxDailyUsd()) > 0) {
                Map<String, Object> details = details("daily", limits.getMaxDailyUsd(), value);
                details.put("committed_usd", spending.getTotal());
                details.put("pending_usd", pendingTotal);
                return InterceptorDecision.limitExceeded(
                        DAILY_CAP_EXCEEDED,
                        "daily cap exceeded: committed " + plain(spending.getTotal()) + " USD + pending "
                                + plain(pendingTotal) + " USD + trade " + plain(value) + " USD > limit "
                                + plain(limits.getMaxDailyUsd()) + " USD",
                        details);
            }

            pending.put(context.getCallId(), new Reservation(value, context.getToolName().getWireName()));
            log.debug(
                    "Spend reserved [callId={}, value={}, committed={}, pending={}]",
                    context.getCallId(),
                    value,
                    spending.getTotal(),
                    pendingTotal.add(value));
            return InterceptorDecision.allow();
        } finally {
            lock.unlock();
        }
    }

    private InterceptorDecision decideUnpriced(ToolCallContext context) {
        if (limits.getUnpricedTradePolicy() == UnpricedTradePolicy.FAIL_OPEN) {
            log.warn(
                    "Admitting unpriced trade under fail-open policy; it is not counted against spend caps "
                            + "[callId={}, tool={}]",
                    context.getCallId(),
                    context.getToolName());
            return InterceptorDecision.allow();
        }
        return InterceptorDecision.limitExceeded(
                UNPRICED_TRADE,
                "trade value could not be determined; unpriced trades are blocked (pass amount_usd)",
                Map.of("limit", "unpriced", "policy", limits.getUnpricedTradePolicy().getWireValue()));
    }

    // ========================
    // CONFIRM / RELEASE
    // ========================

    @Override
    public void record(ToolCallContext context) {
        lock.lock();
        try {
            Reservation reservation = pending.remove(context.getCallId());
            if (reservation == null) {
                return;
            }
            resetDailyTotalIfNeeded();
            spending.add(SpendRecord.builder()
                    .callId(context.getCallId())
                    .tool(reservation.tool)
                    .amountUsd(reservation.amountUsd)
                    .recordedAt(clock.instant())
                    .build());
            log.info(
                    "Spend recorded [callId={}, value={}, dailyTotal={}, limit={}]",
                    context.getCallId(),
                    reservation.amountUsd,
                    spending.getTotal(),
                    limits.getMaxDailyUsd());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(ToolCallContext context) {
        lock.lock();
        try {
            Reservation reservation = pending.remove(context.getCallId());
            if (reservation != null) {
                log.debug("Spend reservation released [callId={}, value={}]", context.getCallId(),
                        reservation.amountUsd);
            }
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // QUERIES
    // ========================

    public SpendSnapshot snapshot() {
        lock.lock();
        try {
            resetDailyTotalIfNeeded();
            BigDecimal pendingTotal = pendingTotal();
            BigDecimal remaining = limits.getMaxDailyUsd()
                    .subtract(spending.getTotal())
                    .subtract(pendingTotal)
                    .max(BigDecimal.ZERO);
            return SpendSnapshot.builder()
                    .date(spending.getDate())
                    .committedUsd(spending.getTotal())
                    .pendingUsd(pendingTotal)
                    .remainingUsd(remaining)
                    .maxDailyUsd(limits.getMaxDailyUsd())
                    .maxPerTradeUsd(limits.getMaxPerTradeUsd())
                    .pendingCount(pending.size())
                    .history(spending.historyCopy())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /** Committed total for the current UTC day. */
    public BigDecimal getDailyTotal() {
        lock.lock();
        try {
            resetDailyTotalIfNeeded();
            return spending.getTotal();
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // INTERNALS (lock held)
    // ========================

    private void resetDailyTotalIfNeeded() {
        LocalDate today = today();
        if (!today.equals(spending.getDate())) {
            log.info(
                    "UTC date changed {} -> {}; resetting daily spend (previous total={}, trades={})",
                    spending.getDate(),
                    today,
                    spending.getTotal(),
                    spending.historyCopy().size());
            spending.resetTo(today);
        }
    }

    private BigDecimal pendingTotal() {
        return pending.values().stream()
                .map(reservation -> reservation.amountUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static Map<String, Object> details(String limitName, BigDecimal limit, BigDecimal observed) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", limitName);
        details.put("limit_usd", limit);
        details.put("observed_usd", observed);
        return details;
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static final class Reservation {
        private final BigDecimal amountUsd;
        private final String tool;

        private Reservation(BigDecimal amountUsd, String tool) {
            this.amountUsd = amountUsd;
            this.tool = tool;
        }
    }
}
