package com.defiguard.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * A tool call in progress. The gateway calls {@link #advance()} repeatedly until a
 * terminal step (DONE or ERROR) comes back; intermediate STREAMING steps are never
 * shown to the script.
 *
 * <p>Implementations may throw {@link com.defiguard.exception.ToolExecutionException}
 * (or any runtime exception), which the gateway treats as a terminal ERROR.
 */
@FunctionalInterface
public interface ToolExchange {

    ToolStep advance();

    /** Exchange that completes in a single step by running {@code work}. */
    static ToolExchange completed(Supplier<JsonNode> work) {
        AtomicBoolean consumed = new AtomicBoolean(false);
        return () -> {
            if (consumed.getAndSet(true)) {
                throw new IllegalStateException("Exchange already completed");
            }
            return ToolStep.done(work.get());
        };
    }
}
