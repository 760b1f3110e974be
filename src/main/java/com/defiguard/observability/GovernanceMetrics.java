package com.defiguard.observability;

import com.defiguard.governance.GovernedCallResult;
import com.defiguard.governance.SpendLimitTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for the governance path:
 * <ul>
 *   <li><b>governance.calls</b> (counter, tags tool/outcome): every call that reached the pipeline</li>
 *   <li><b>governance.blocks</b> (counter, tags stage/code): calls stopped by a stage</li>
 *   <li><b>governance.rejections</b> (counter, tag code): unknown tool or invalid arguments</li>
 *   <li><b>governance.auth.failures</b> (counter): invalid or revoked invocation tokens</li>
 *   <li><b>governance.call.latency</b> (timer, tag tool): pipeline plus execution time</li>
 *   <li><b>governance.spend.daily.usd</b> (gauge): committed spend for the current UTC day</li>
 * </ul>
 */
public class GovernanceMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter authFailures;

    public GovernanceMetrics(MeterRegistry meterRegistry, SpendLimitTracker spendLimitTracker) {
        this.meterRegistry = meterRegistry;
        this.authFailures = Counter.builder("governance.auth.failures")
                .description("Tool calls rejected for an invalid or revoked invocation token")
                .register(meterRegistry);

        // polled on scrape
        meterRegistry.gauge("governance.spend.daily.usd", spendLimitTracker, tracker -> tracker.getDailyTotal()
                .doubleValue());
    }

    public void recordCall(GovernedCallResult result) {
        String tool = result.getContext().getToolName().getWireName();
        String outcome = result.isBlocked()
                ? "blocked"
                : result.getExecution().getOutcome().name().toLowerCase(Locale.ROOT);

        Counter.builder("governance.calls")
                .description("Tool calls that reached the governance pipeline")
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();

        if (result.isBlocked()) {
            Counter.builder("governance.blocks")
                    .description("Tool calls blocked by a governance stage")
                    .tag("stage", result.getBlockedAt().getLabel())
                    .tag("code", result.getDecision().getCode())
                    .register(meterRegistry)
                    .increment();
        }

        Timer.builder("governance.call.latency")
                .description("Governance pipeline plus tool execution latency")
                .tag("tool", tool)
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry)
                .record(result.getLatency());
    }

    public void recordRejection(String code) {
        Counter.builder("governance.rejections")
                .description("Tool calls rejected before the pipeline")
                .tag("code", code)
                .register(meterRegistry)
                .increment();
    }

    public void recordAuthFailure() {
        authFailures.increment();
    }
}
