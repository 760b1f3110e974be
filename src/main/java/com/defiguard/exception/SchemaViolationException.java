package com.defiguard.exception;

import java.util.Map;

/**
 * Tool arguments failed schema validation. Thrown before any governance stage or
 * tool logic runs.
 */
public class SchemaViolationException extends BaseException {

    public SchemaViolationException(String message) {
        super(ErrorCode.SCHEMA_VIOLATION, message);
    }

    public SchemaViolationException(String message, Map<String, Object> details) {
        super(ErrorCode.SCHEMA_VIOLATION, message, details);
    }
}
