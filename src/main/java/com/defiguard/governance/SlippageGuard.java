package com.defiguard.governance;

import com.defiguard.tool.ToolCallContext;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stage 3: stateless ceilings on the slippage tolerance a capital-committing call asks
 * for and on the price impact its quote reported. Read-only and signing calls pass.
 */
public class SlippageGuard implements ToolCallInterceptor {

    static final String SLIPPAGE_EXCEEDED = "SLIPPAGE_EXCEEDED";
    static final String PRICE_IMPACT_EXCEEDED = "PRICE_IMPACT_EXCEEDED";

    private final BigDecimal maxSlippagePercent;
    private final BigDecimal maxPriceImpactPercent;

    public SlippageGuard(BigDecimal maxSlippagePercent, BigDecimal maxPriceImpactPercent) {
        this.maxSlippagePercent = maxSlippagePercent;
        this.maxPriceImpactPercent = maxPriceImpactPercent;
    }

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.SLIPPAGE;
    }

    @Override
    public InterceptorDecision decide(ToolCallContext context) {
        if (!context.isCapitalCommitting()) {
            return InterceptorDecision.allow();
        }

        Optional<BigDecimal> slippage = context.getSlippagePercent();
        if (slippage.isPresent() && slippage.get().compareTo(maxSlippagePercent) > 0) {
            return InterceptorDecision.limitExceeded(
                    SLIPPAGE_EXCEEDED,
                    "Requested slippage " + plain(slippage.get()) + "% exceeds maximum allowed "
                            + plain(maxSlippagePercent) + "%",
                    details("slippage", maxSlippagePercent, slippage.get()));
        }

        Optional<BigDecimal> impact = context.getPriceImpactPercent();
        if (impact.isPresent() && impact.get().compareTo(maxPriceImpactPercent) > 0) {
            return InterceptorDecision.limitExceeded(
                    PRICE_IMPACT_EXCEEDED,
                    "Reported price impact " + plain(impact.get()) + "% exceeds maximum allowed "
                            + plain(maxPriceImpactPercent) + "%",
                    details("price_impact", maxPriceImpactPercent, impact.get()));
        }
        return InterceptorDecision.allow();
    }

    /**
     * Checks the price impact of a quote fetched after admission, which the script may not
     * have reported. Returns the violation message, or empty when within the ceiling.
     */
    public Optional<String> checkQuotedPriceImpact(BigDecimal impactPercent) {
        if (impactPercent == null || impactPercent.compareTo(maxPriceImpactPercent) <= 0) {
            return Optional.empty();
        }
        return Optional.of("Quoted price impact " + plain(impactPercent) + "% exceeds maximum allowed "
                + plain(maxPriceImpactPercent) + "%");
    }

    private static Map<String, Object> details(String limitName, BigDecimal limit, BigDecimal observed) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", limitName);
        details.put("limit_percent", limit);
        details.put("observed_percent", observed);
        return details;
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
