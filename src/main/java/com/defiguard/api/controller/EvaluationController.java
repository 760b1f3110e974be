package com.defiguard.api.controller;

import com.defiguard.auth.InvocationGrant;
import com.defiguard.auth.InvocationTokenService;
import com.defiguard.exception.ResourceNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Script evaluation lifecycle.
 *
 * <ul>
 *   <li>POST /api/evaluations -- start an evaluation, returns its invocation token</li>
 *   <li>DELETE /api/evaluations/{id} -- cancel it; the token stops working and calls in flight are abandoned</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/evaluations")
public class EvaluationController {

    private final InvocationTokenService invocationTokenService;

    public EvaluationController(InvocationTokenService invocationTokenService) {
        this.invocationTokenService = invocationTokenService;
    }

    @PostMapping
    public ResponseEntity<InvocationGrant> start() {
        return ResponseEntity.status(HttpStatus.CREATED).body(invocationTokenService.issue());
    }

    @DeleteMapping("/{evaluationId}")
    public ResponseEntity<Void> cancel(@PathVariable String evaluationId) {
        if (!invocationTokenService.revoke(evaluationId)) {
            throw new ResourceNotFoundException("Evaluation", evaluationId);
        }
        return ResponseEntity.noContent().build();
    }
}
