package com.defiguard.governance;

import com.defiguard.exception.ErrorCode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Allow, or Block with a category, a machine-readable code, a human-readable reason and
 * (for policy blocks) the rule id. Immutable.
 *
 * <p>Block codes used by the stages:
 * <ul>
 *   <li>{@code POLICY_RULE}, {@code POLICY_DEFAULT}, {@code UNKNOWN_TOOL}</li>
 *   <li>{@code PER_TRADE_CAP_EXCEEDED}, {@code DAILY_CAP_EXCEEDED}, {@code UNPRICED_TRADE}</li>
 *   <li>{@code SLIPPAGE_EXCEEDED}, {@code PRICE_IMPACT_EXCEEDED}</li>
 *   <li>{@code COOLDOWN_ACTIVE}</li>
 *   <li>{@code STAGE_FAILURE} when a stage itself throws</li>
 * </ul>
 */
@Getter
public final class InterceptorDecision {

    private static final InterceptorDecision ALLOW = new InterceptorDecision(true, null, null, null, null, Map.of());

    private final boolean allowed;
    private final ErrorCode category;
    private final String code;
    private final String reason;
    private final String ruleId;
    /** Limit, observed value and similar context for limit blocks. */
    private final Map<String, Object> details;

    private InterceptorDecision(
            boolean allowed,
            ErrorCode category,
            String code,
            String reason,
            String ruleId,
            Map<String, Object> details) {
        this.allowed = allowed;
        this.category = category;
        this.code = code;
        this.reason = reason;
        this.ruleId = ruleId;
        this.details = details;
    }

    public static InterceptorDecision allow() {
        return ALLOW;
    }

    public static InterceptorDecision policyDenied(String code, String reason, String ruleId) {
        return new InterceptorDecision(false, ErrorCode.POLICY_DENIED, code, reason, ruleId, Map.of());
    }

    public static InterceptorDecision limitExceeded(String code, String reason, Map<String, Object> details) {
        return new InterceptorDecision(false, ErrorCode.LIMIT_EXCEEDED, code, reason, null, copyOf(details));
    }

    static InterceptorDecision stageFailure(GovernanceStage stage) {
        return new InterceptorDecision(
                false,
                ErrorCode.INTERNAL_ERROR,
                "STAGE_FAILURE",
                "Governance stage " + stage.getLabel() + " failed; call blocked",
                null,
                Map.of("stage", stage.getLabel()));
    }

    public boolean isBlocked() {
        return !allowed;
    }

    private static Map<String, Object> copyOf(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @Override
    public String toString() {
        if (allowed) {
            return "Allow";
        }
        return "Block{" + code + ": " + reason + (ruleId != null ? ", ruleId=" + ruleId : "") + "}";
    }
}
