package com.defiguard.tool;

/**
 * Host-side implementation of one {@link ToolName}.
 *
 * <p>The gateway binds and validates arguments against {@link #argumentsType()}, lets
 * the handler fill in governance metadata via {@link #describe}, runs the governance
 * pipeline, and only then calls {@link #open} to start the exchange.
 */
public interface ToolHandler<A extends ToolArguments> {

    ToolName toolName();

    Class<A> argumentsType();

    /**
     * Contributes action kind, trade value, slippage, network and cooldown symbol to the
     * context being built. Must not perform I/O.
     */
    void describe(A arguments, ToolCallContext.ToolCallContextBuilder context);

    ToolExchange open(A arguments, ToolCallContext context);
}
