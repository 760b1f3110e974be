package com.defiguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    SCHEMA_VIOLATION("SCHEMA_VIOLATION", 400),
    AUTHENTICATION_FAILURE("AUTHENTICATION_FAILURE", 401),
    POLICY_DENIED("POLICY_DENIED", 403),
    NOT_FOUND("NOT_FOUND", 404),
    UNKNOWN_TOOL("UNKNOWN_TOOL", 404),
    LIMIT_EXCEEDED("LIMIT_EXCEEDED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    FATAL_CONFIGURATION("FATAL_CONFIGURATION", 500),
    WALLET_ERROR("WALLET_ERROR", 500),
    EXECUTION_ERROR("EXECUTION_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
