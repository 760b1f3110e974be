package com.defiguard.api.controller;

import com.defiguard.audit.AuditLog;
import com.defiguard.audit.AuditRecord;
import com.defiguard.governance.SpendLimitTracker;
import com.defiguard.governance.SpendSnapshot;
import com.defiguard.policy.PolicyDocument;
import com.defiguard.policy.PolicyEngine;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator view of governance state.
 *
 * <ul>
 *   <li>GET /api/governance/audit?limit=N -- most recent audit records, newest first</li>
 *   <li>GET /api/governance/spend -- today's committed and pending spend</li>
 *   <li>GET /api/governance/policy -- active policy document</li>
 *   <li>POST /api/governance/policy/reload -- re-read the policy file; an invalid file leaves the active one in place</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/governance")
public class GovernanceController {

    static final int MAX_AUDIT_LIMIT = 1000;

    private final AuditLog auditLog;
    private final SpendLimitTracker spendLimitTracker;
    private final PolicyEngine policyEngine;

    public GovernanceController(AuditLog auditLog, SpendLimitTracker spendLimitTracker, PolicyEngine policyEngine) {
        this.auditLog = auditLog;
        this.spendLimitTracker = spendLimitTracker;
        this.policyEngine = policyEngine;
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditRecord>> getAudit(@RequestParam(defaultValue = "100") int limit) {
        int bounded = Math.max(0, Math.min(limit, MAX_AUDIT_LIMIT));
        return ResponseEntity.ok(auditLog.recent(bounded));
    }

    @GetMapping("/spend")
    public ResponseEntity<SpendSnapshot> getSpend() {
        return ResponseEntity.ok(spendLimitTracker.snapshot());
    }

    @GetMapping("/policy")
    public ResponseEntity<PolicyDocument> getPolicy() {
        return ResponseEntity.ok(policyEngine.getDocument());
    }

    @PostMapping("/policy/reload")
    public ResponseEntity<PolicyDocument> reloadPolicy() {
        return ResponseEntity.ok(policyEngine.reload());
    }
}
