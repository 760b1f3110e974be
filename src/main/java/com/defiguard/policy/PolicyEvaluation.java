package com.defiguard.policy;

import lombok.Getter;
import lombok.ToString;

/** Outcome of evaluating one tool name against the current policy document. */
@Getter
@ToString
public class PolicyEvaluation {

    static final String DEFAULT_ALLOW_REASON = "allowed by default policy";
    static final String DEFAULT_DENY_REASON = "denied by default policy";

    private final boolean allowed;
    private final String reason;
    /** Null when the default mode decided. */
    private final String ruleId;

    private PolicyEvaluation(boolean allowed, String reason, String ruleId) {
        this.allowed = allowed;
        this.reason = reason;
        this.ruleId = ruleId;
    }

    static PolicyEvaluation fromRule(PolicyRule rule) {
        return new PolicyEvaluation(rule.isAllowed(), rule.getReason(), rule.getRuleId());
    }

    static PolicyEvaluation fromMode(PolicyMode mode) {
        return mode == PolicyMode.DEFAULT_ALLOW
                ? new PolicyEvaluation(true, DEFAULT_ALLOW_REASON, null)
                : new PolicyEvaluation(false, DEFAULT_DENY_REASON, null);
    }

    static PolicyEvaluation rejected(String reason) {
        return new PolicyEvaluation(false, reason, null);
    }

    /** {@code Policy denied tool <tool>: <reason>[ rule_id=<id>]} */
    public String describeDenial(String toolName) {
        String suffix = ruleId != null ? " rule_id=" + ruleId : "";
        return "Policy denied tool " + toolName + ": " + reason + suffix;
    }
}
