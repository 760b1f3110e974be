package com.defiguard.api.controller;

import com.defiguard.exception.ErrorCode;
import com.defiguard.gateway.ToolCallRequest;
import com.defiguard.gateway.ToolCallResponse;
import com.defiguard.gateway.ToolInvocationGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The sandbox bridge endpoint.
 *
 * <p>POST /api/tool-calls takes {@code {tool_name, args, invocation_token}} and returns a
 * terminal {@code {status, output?, error?}}. Governance blocks and tool errors are
 * protocol-level results (HTTP 200); only an authentication failure is answered with 401.
 */
@RestController
@RequestMapping("/api/tool-calls")
public class ToolCallController {

    private final ToolInvocationGateway toolInvocationGateway;

    public ToolCallController(ToolInvocationGateway toolInvocationGateway) {
        this.toolInvocationGateway = toolInvocationGateway;
    }

    @PostMapping
    public ResponseEntity<ToolCallResponse> invoke(@RequestBody ToolCallRequest request) {
        ToolCallResponse response = toolInvocationGateway.invoke(request);
        if (response.getError() != null
                && ErrorCode.AUTHENTICATION_FAILURE.getCode().equals(response.getError().getCode())) {
            return ResponseEntity.status(ErrorCode.AUTHENTICATION_FAILURE.getHttpStatus()).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
