package com.defiguard.governance;

/** How an admitted call ended. Only {@link #SUCCEEDED} lets stateful stages record. */
public enum CallOutcome {
    SUCCEEDED,
    FAILED,
    /** Timed out, cancelled, or ran out of steps before a terminal status. */
    ABANDONED
}
