package com.defiguard.gateway;

import com.defiguard.audit.AuditLog;
import com.defiguard.auth.InvocationTokenService;
import com.defiguard.exception.BaseException;
import com.defiguard.exception.ErrorCode;
import com.defiguard.exception.SchemaViolationException;
import com.defiguard.exception.UnauthorizedException;
import com.defiguard.governance.ExecutionResult;
import com.defiguard.governance.GovernancePipeline;
import com.defiguard.governance.GovernedCallResult;
import com.defiguard.governance.InterceptorDecision;
import com.defiguard.observability.GovernanceMetrics;
import com.defiguard.tool.ArgumentBinder;
import com.defiguard.tool.Network;
import com.defiguard.tool.ToolArguments;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolExchange;
import com.defiguard.tool.ToolHandler;
import com.defiguard.tool.ToolRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only bridge between the sandboxed script and host capabilities.
 *
 * <p>Handling of one call:
 * <ol>
 *   <li>Token check. Failure returns AUTHENTICATION_FAILURE and nothing is audited</li>
 *   <li>Tool lookup in the closed registry (UNKNOWN_TOOL, audited as REJECTED)</li>
 *   <li>Argument binding and validation (SCHEMA_VIOLATION, audited as REJECTED)</li>
 *   <li>Context build: default network, then the handler's action kind, trade value,
 *       slippage and cooldown symbol</li>
 *   <li>Governance pipeline, which drives the admitted call to DONE or ERROR and
 *       audits it</li>
 * </ol>
 *
 * <p>The response is always terminal. A call still running when its evaluation is
 * revoked is abandoned.
 */
public class ToolInvocationGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolInvocationGateway.class);

    private final InvocationTokenService tokenService;
    private final ToolRegistry toolRegistry;
    private final ArgumentBinder argumentBinder;
    private final GovernancePipeline governancePipeline;
    private final ToolCallDriver toolCallDriver;
    private final AuditLog auditLog;
    private final GovernanceMetrics governanceMetrics;
    private final Network defaultNetwork;
    private final Clock clock;

    public ToolInvocationGateway(
            InvocationTokenService tokenService,
            ToolRegistry toolRegistry,
            ArgumentBinder argumentBinder,
            GovernancePipeline governancePipeline,
            ToolCallDriver toolCallDriver,
            AuditLog auditLog,
            GovernanceMetrics governanceMetrics,
            Network defaultNetwork,
            Clock clock) {
        this.tokenService = tokenService;
        this.toolRegistry = toolRegistry;
        this.argumentBinder = argumentBinder;
        this.governancePipeline = governancePipeline;
        this.toolCallDriver = toolCallDriver;
        this.auditLog = auditLog;
        this.governanceMetrics = governanceMetrics;
        this.defaultNetwork = defaultNetwork;
        this.clock = clock;
    }

    public ToolCallResponse invoke(ToolCallRequest request) {
        // Step 1: authentication, before anything else looks at the request
        String evaluationId;
        try {
            evaluationId = tokenService.validate(request.getInvocationToken());
        } catch (UnauthorizedException e) {
            governanceMetrics.recordAuthFailure();
            log.warn("Tool call rejected: {}", e.getMessage());
            return ToolCallResponse.error(null, error(ErrorCode.AUTHENTICATION_FAILURE, null, e.getMessage()));
        }

        String callId = UUID.randomUUID().toString();
        String rawTool = request.getToolName();
        JsonNode rawArguments = request.getArgs();

        // Step 2: closed tool set
        Optional<ToolHandler<?>> handler = toolRegistry.find(rawTool);
        if (handler.isEmpty()) {
            String message = rawTool != null && rawTool.length() <= 64
                    ? "Unknown tool '" + rawTool + "'"
                    : "Unknown tool";
            auditLog.recordRejected(callId, evaluationId, null, rawTool, rawArguments, ErrorCode.UNKNOWN_TOOL, message);
            governanceMetrics.recordRejection(ErrorCode.UNKNOWN_TOOL.getCode());
            return ToolCallResponse.error(callId, error(ErrorCode.UNKNOWN_TOOL, null, message));
        }

        return dispatch(handler.get(), callId, evaluationId, rawArguments);
    }

    private <A extends ToolArguments> ToolCallResponse dispatch(
            ToolHandler<A> handler, String callId, String evaluationId, JsonNode rawArguments) {
        // Step 3: schema
        A arguments;
        try {
            arguments = argumentBinder.bind(handler.toolName(), rawArguments, handler.argumentsType());
        } catch (SchemaViolationException e) {
            auditLog.recordRejected(callId, evaluationId, handler.toolName(), null, rawArguments,
                    ErrorCode.SCHEMA_VIOLATION, e.getMessage());
            governanceMetrics.recordRejection(ErrorCode.SCHEMA_VIOLATION.getCode());
            return ToolCallResponse.error(callId, ToolCallError.builder()
                    .code(ErrorCode.SCHEMA_VIOLATION.getCode())
                    .message(e.getMessage())
                    .details(e.getDetails())
                    .build());
        }

        // Step 4: context
        ToolCallContext.ToolCallContextBuilder builder = ToolCallContext.builder()
                .callId(callId)
                .evaluationId(evaluationId)
                .toolName(handler.toolName())
                .arguments(arguments)
                .rawArguments(rawArguments)
                .network(defaultNetwork)
                .requestedAt(clock.instant());
        handler.describe(arguments, builder);
        ToolCallContext context = builder.build();

        // Step 5: governance + execution
        GovernedCallResult result = governancePipeline.run(context, admitted -> execute(handler, arguments, admitted));
        return toResponse(result);
    }

    private <A extends ToolArguments> ExecutionResult execute(
            ToolHandler<A> handler, A arguments, ToolCallContext context) {
        ToolExchange exchange;
        try {
            exchange = handler.open(arguments, context);
        } catch (BaseException e) {
            log.warn("Tool {} could not start [callId={}]: {}", handler.toolName(), context.getCallId(),
                    e.getMessage());
            return ExecutionResult.failed(e.getMessage(), 0);
        }
        String evaluationId = context.getEvaluationId();
        return toolCallDriver.drive(exchange, context, () -> !tokenService.isActive(evaluationId));
    }

    private static ToolCallResponse toResponse(GovernedCallResult result) {
        String callId = result.getContext().getCallId();
        if (result.isBlocked()) {
            InterceptorDecision decision = result.getDecision();
            return ToolCallResponse.error(callId, ToolCallError.builder()
                    .code(decision.getCategory().getCode())
                    .reasonCode(decision.getCode())
                    .message(decision.getReason())
                    .ruleId(decision.getRuleId())
                    .details(decision.getDetails())
                    .build());
        }

        ExecutionResult execution = result.getExecution();
        return switch (execution.getOutcome()) {
            case SUCCEEDED -> ToolCallResponse.done(callId, execution.getOutput());
            case FAILED -> ToolCallResponse.error(
                    callId, error(ErrorCode.EXECUTION_ERROR, null, execution.getErrorMessage()));
            case ABANDONED -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("outcome", "abandoned");
                details.put("steps", execution.getSteps());
                yield ToolCallResponse.error(callId, ToolCallError.builder()
                        .code(ErrorCode.EXECUTION_ERROR.getCode())
                        .reasonCode("ABANDONED")
                        .message(execution.getErrorMessage())
                        .details(details)
                        .build());
            }
        };
    }

    private static ToolCallError error(ErrorCode code, String reasonCode, String message) {
        return ToolCallError.builder()
                .code(code.getCode())
                .reasonCode(reasonCode)
                .message(message)
                .build();
    }
}
