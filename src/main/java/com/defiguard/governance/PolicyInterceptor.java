package com.defiguard.governance;

import com.defiguard.policy.PolicyEngine;
import com.defiguard.policy.PolicyEvaluation;
import com.defiguard.tool.ToolCallContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stage 1: the declarative allow/deny policy. */
public class PolicyInterceptor implements ToolCallInterceptor {

    private static final Logger log = LoggerFactory.getLogger(PolicyInterceptor.class);

    private final PolicyEngine policyEngine;

    public PolicyInterceptor(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.POLICY;
    }

    @Override
    public InterceptorDecision decide(ToolCallContext context) {
        String tool = context.getToolName().getWireName();
        PolicyEvaluation evaluation = policyEngine.evaluate(context.getToolName());
        if (evaluation.isAllowed()) {
            log.debug("Policy allowed [callId={}, tool={}, reason={}]", context.getCallId(), tool,
                    evaluation.getReason());
            return InterceptorDecision.allow();
        }
        String code = evaluation.getRuleId() != null ? "POLICY_RULE" : "POLICY_DEFAULT";
        return InterceptorDecision.policyDenied(code, evaluation.describeDenial(tool), evaluation.getRuleId());
    }
}
