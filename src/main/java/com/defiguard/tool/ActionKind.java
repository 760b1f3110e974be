package com.defiguard.tool;

/**
 * What a tool call does to the outside world. Only {@link #CAPITAL_COMMITTING} calls
 * are subject to spend limits and cooldown.
 */
public enum ActionKind {
    /** Quotes, address derivation, data lookups. */
    READ_ONLY,
    /** Produces a signature but moves no tracked value by itself. */
    SIGNING,
    /** Commits capital (e.g. preparing a swap for execution). */
    CAPITAL_COMMITTING
}
