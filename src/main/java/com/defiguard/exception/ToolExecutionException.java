package com.defiguard.exception;

/**
 * Failure inside an underlying tool or collaborator. Surfaced to the script as an
 * {@code error} response; never mutates tracker state.
 */
public class ToolExecutionException extends BaseException {

    public ToolExecutionException(String message) {
        super(ErrorCode.EXECUTION_ERROR, message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, cause);
    }
}
