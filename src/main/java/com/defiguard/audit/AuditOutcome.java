package com.defiguard.audit;

/** Final decision recorded for one call attempt. */
public enum AuditOutcome {
    /** Passed every stage and reached DONE. */
    SUCCEEDED,
    /** Stopped by a governance stage. */
    BLOCKED,
    /** Passed every stage; the tool failed. */
    EXECUTION_ERROR,
    /** Passed every stage; cancelled or timed out before a terminal status. */
    ABANDONED,
    /** Never reached the pipeline: unknown tool or invalid arguments. */
    REJECTED
}
