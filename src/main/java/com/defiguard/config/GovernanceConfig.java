package com.defiguard.config;

import com.defiguard.audit.AuditLog;
import com.defiguard.exception.ConfigurationException;
import com.defiguard.governance.CooldownGate;
import com.defiguard.governance.GovernancePipeline;
import com.defiguard.governance.PolicyInterceptor;
import com.defiguard.governance.SlippageGuard;
import com.defiguard.governance.SpendLimitTracker;
import com.defiguard.governance.SpendLimits;
import com.defiguard.governance.ToolCallInterceptor;
import com.defiguard.governance.UnpricedTradePolicy;
import com.defiguard.observability.GovernanceMetrics;
import com.defiguard.policy.PolicyEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the governance stages, the pipeline and the audit log from
 * application.properties.
 *
 * <p>Spend caps and the unpriced-trade policy have no code defaults: a missing or
 * invalid value aborts startup.
 *
 * <p>Properties prefixes: {@code defiguard.spend.*}, {@code defiguard.slippage.*},
 * {@code defiguard.cooldown.*}, {@code defiguard.audit.*}
 */
@Configuration
public class GovernanceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SpendLimits spendLimits(
            @Value("${defiguard.spend.max-per-trade-usd}") BigDecimal maxPerTradeUsd,
            @Value("${defiguard.spend.max-daily-usd}") BigDecimal maxDailyUsd,
            @Value("${defiguard.spend.unpriced-trade-policy:#{null}}") String unpricedTradePolicy) {
        requirePositive("defiguard.spend.max-per-trade-usd", maxPerTradeUsd);
        requirePositive("defiguard.spend.max-daily-usd", maxDailyUsd);
        return SpendLimits.builder()
                .maxPerTradeUsd(maxPerTradeUsd)
                .maxDailyUsd(maxDailyUsd)
                .unpricedTradePolicy(UnpricedTradePolicy.parse(unpricedTradePolicy))
                .build();
    }

    @Bean
    public SpendLimitTracker spendLimitTracker(SpendLimits spendLimits, Clock clock) {
        return new SpendLimitTracker(spendLimits, clock);
    }

    @Bean
    public SlippageGuard slippageGuard(
            @Value("${defiguard.slippage.max-slippage-percent}") BigDecimal maxSlippagePercent,
            @Value("${defiguard.slippage.max-price-impact-percent}") BigDecimal maxPriceImpactPercent) {
        requirePositive("defiguard.slippage.max-slippage-percent", maxSlippagePercent);
        requirePositive("defiguard.slippage.max-price-impact-percent", maxPriceImpactPercent);
        return new SlippageGuard(maxSlippagePercent, maxPriceImpactPercent);
    }

    @Bean
    public CooldownGate cooldownGate(
            @Value("${defiguard.cooldown.seconds}") long cooldownSeconds,
            @Value("${defiguard.cooldown.per-symbol:false}") boolean perSymbol,
            Clock clock) {
        if (cooldownSeconds < 0) {
            throw new ConfigurationException("defiguard.cooldown.seconds must not be negative");
        }
        return new CooldownGate(Duration.ofSeconds(cooldownSeconds), perSymbol, clock);
    }

    @Bean
    public PolicyInterceptor policyInterceptor(PolicyEngine policyEngine) {
        return new PolicyInterceptor(policyEngine);
    }

    @Bean(destroyMethod = "close")
    public AuditLog auditLog(
            ObjectMapper objectMapper, Clock clock, @Value("${defiguard.audit.file:}") String auditFile) {
        try {
            return new AuditLog(objectMapper, clock, auditFile.isBlank() ? null : Path.of(auditFile));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot open audit log file " + auditFile, e);
        }
    }

    @Bean
    public GovernanceMetrics governanceMetrics(MeterRegistry meterRegistry, SpendLimitTracker spendLimitTracker) {
        return new GovernanceMetrics(meterRegistry, spendLimitTracker);
    }

    @Bean
    public GovernancePipeline governancePipeline(
            List<ToolCallInterceptor> interceptors, AuditLog auditLog, GovernanceMetrics governanceMetrics) {
        return new GovernancePipeline(interceptors, auditLog, governanceMetrics);
    }

    private static void requirePositive(String key, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new ConfigurationException(key + " must be a positive number");
        }
    }
}
