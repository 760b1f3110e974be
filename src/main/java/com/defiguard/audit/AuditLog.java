package com.defiguard.audit;

import com.defiguard.exception.ErrorCode;
import com.defiguard.governance.ExecutionResult;
import com.defiguard.governance.GovernedCallResult;
import com.defiguard.governance.InterceptorDecision;
import com.defiguard.tool.ToolCallContext;
import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only record of every call attempt that got past authentication.
 *
 * <p>Each record is numbered, written to the optional JSON-lines file (one object per
 * line, never rewritten) and pushed onto an in-memory ring buffer of the last
 * {@value #RING_BUFFER_SIZE} records, newest first, for quick queries. The file is the
 * durable stream; the ring buffer only caches its tail.
 *
 * <p>A failed file write is logged at ERROR and the record still reaches the ring
 * buffer and the application log.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BufferedWriter fileSink;
    private final Path filePath;

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentLinkedDeque<AuditRecord> ringBuffer = new ConcurrentLinkedDeque<>();
    private final ReentrantLock appendLock = new ReentrantLock();

    /**
     * @param filePath JSON-lines sink, or null to keep records in memory only
     * @throws IOException if the sink cannot be opened for appending
     */
    public AuditLog(ObjectMapper objectMapper, Clock clock, Path filePath) throws IOException {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.filePath = filePath;
        if (filePath != null) {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.fileSink = Files.newBufferedWriter(
                    filePath, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.info("Audit log writing to {}", filePath.toAbsolutePath());
        } else {
            this.fileSink = null;
        }
    }

    // ---- Governed calls ----

    /** Records the final outcome of a call that went through the pipeline. */
    public AuditRecord recordGovernedCall(GovernedCallResult result) {
        ToolCallContext context = result.getContext();
        AuditRecord.AuditRecordBuilder builder = AuditRecord.builder()
                .callId(context.getCallId())
                .evaluationId(context.getEvaluationId())
                .tool(context.getToolName().getWireName())
                .actionKind(context.getActionKind())
                .tradeValueUsd(context.getTradeValue().orElse(null))
                .network(context.getNetwork() != null ? context.getNetwork().getWireName() : null)
                .arguments(ArgumentRedactor.redact(context.getToolName(), context.getRawArguments()))
                .latencyMs(result.getLatency().toMillis());

        if (result.isBlocked()) {
            InterceptorDecision decision = result.getDecision();
            builder.outcome(AuditOutcome.BLOCKED)
                    .stage(result.getBlockedAt())
                    .code(decision.getCode())
                    .reason(decision.getReason())
                    .ruleId(decision.getRuleId())
                    .details(decision.getDetails().isEmpty() ? null : decision.getDetails());
        } else {
            ExecutionResult execution = result.getExecution();
            switch (execution.getOutcome()) {
                case SUCCEEDED -> builder.outcome(AuditOutcome.SUCCEEDED);
                case FAILED -> builder.outcome(AuditOutcome.EXECUTION_ERROR)
                        .code(ErrorCode.EXECUTION_ERROR.getCode())
                        .reason(execution.getErrorMessage());
                case ABANDONED -> builder.outcome(AuditOutcome.ABANDONED)
                        .code("ABANDONED")
                        .reason(execution.getErrorMessage());
            }
        }
        return append(builder);
    }

    // ---- Pre-pipeline rejections ----

    /**
     * Records a call rejected before the pipeline (unknown tool, schema violation).
     *
     * @param toolName the resolved tool, or null if the name was not recognized
     * @param rawTool  the name as sent by the script
     */
    public AuditRecord recordRejected(
            String callId,
            String evaluationId,
            ToolName toolName,
            String rawTool,
            JsonNode rawArguments,
            ErrorCode errorCode,
            String reason) {
        return append(AuditRecord.builder()
                .callId(callId)
                .evaluationId(evaluationId)
                .tool(toolName != null ? toolName.getWireName() : truncate(rawTool))
                .outcome(AuditOutcome.REJECTED)
                .code(errorCode.getCode())
                .reason(reason)
                .arguments(ArgumentRedactor.redact(toolName, rawArguments)));
    }

    // ---- Queries ----

    /** The most recent {@code limit} records, newest first. */
    public List<AuditRecord> recent(int limit) {
        return ringBuffer.stream().limit(Math.max(0, limit)).toList();
    }

    /** Number of records appended since startup. */
    public long getTotalRecorded() {
        return sequence.get();
    }

    public void close() {
        if (fileSink == null) {
            return;
        }
        appendLock.lock();
        try {
            fileSink.close();
        } catch (IOException e) {
            log.error("Failed to close audit log {}: {}", filePath, e.getMessage());
        } finally {
            appendLock.unlock();
        }
    }

    // ---- Internals ----

    private AuditRecord append(AuditRecord.AuditRecordBuilder builder) {
        appendLock.lock();
        try {
            AuditRecord record = builder.sequence(sequence.incrementAndGet())
                    .timestamp(clock.instant())
                    .build();
            writeToFile(record);
            ringBuffer.addFirst(record);
            while (ringBuffer.size() > RING_BUFFER_SIZE) {
                ringBuffer.pollLast();
            }
            logRecord(record);
            return record;
        } finally {
            appendLock.unlock();
        }
    }

    private void writeToFile(AuditRecord record) {
        if (fileSink == null) {
            return;
        }
        try {
            fileSink.write(objectMapper.writeValueAsString(record));
            fileSink.newLine();
            fileSink.flush();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit record seq={}: {}", record.getSequence(), e.getOriginalMessage());
        } catch (IOException e) {
            log.error("Failed to append audit record seq={} to {}: {}", record.getSequence(), filePath,
                    e.getMessage());
        }
    }

    private static void logRecord(AuditRecord record) {
        switch (record.getOutcome()) {
            case SUCCEEDED -> log.info(
                    "AUDIT seq={} callId={} tool={} outcome=SUCCEEDED", record.getSequence(), record.getCallId(),
                    record.getTool());
            case BLOCKED -> log.warn(
                    "AUDIT seq={} callId={} tool={} outcome=BLOCKED stage={} code={} reason={}",
                    record.getSequence(), record.getCallId(), record.getTool(), record.getStage(),
                    record.getCode(), record.getReason());
            case EXECUTION_ERROR -> log.error(
                    "AUDIT seq={} callId={} tool={} outcome=EXECUTION_ERROR reason={}", record.getSequence(),
                    record.getCallId(), record.getTool(), record.getReason());
            default -> log.warn(
                    "AUDIT seq={} callId={} tool={} outcome={} code={} reason={}", record.getSequence(),
                    record.getCallId(), record.getTool(), record.getOutcome(), record.getCode(),
                    record.getReason());
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= ArgumentRedactor.MAX_STRING_LENGTH) {
            return value;
        }
        return value.substring(0, ArgumentRedactor.MAX_STRING_LENGTH) + "...[truncated]";
    }
}
