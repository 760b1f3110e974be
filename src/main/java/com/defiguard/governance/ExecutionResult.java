package com.defiguard.governance;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.ToString;

/** What happened when an admitted call was driven to completion. */
@Getter
@ToString(exclude = "output")
public final class ExecutionResult {

    private final CallOutcome outcome;
    private final JsonNode output;
    private final String errorMessage;
    /** Exchange steps taken, including the terminal one. */
    private final int steps;

    private ExecutionResult(CallOutcome outcome, JsonNode output, String errorMessage, int steps) {
        this.outcome = outcome;
        this.output = output;
        this.errorMessage = errorMessage;
        this.steps = steps;
    }

    public static ExecutionResult succeeded(JsonNode output, int steps) {
        return new ExecutionResult(CallOutcome.SUCCEEDED, output, null, steps);
    }

    public static ExecutionResult failed(String errorMessage, int steps) {
        return new ExecutionResult(CallOutcome.FAILED, null, errorMessage, steps);
    }

    public static ExecutionResult abandoned(String reason, int steps) {
        return new ExecutionResult(CallOutcome.ABANDONED, null, reason, steps);
    }

    public boolean isSucceeded() {
        return outcome == CallOutcome.SUCCEEDED;
    }
}
