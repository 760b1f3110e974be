package com.defiguard.exception;

/**
 * Unrecoverable startup problem: malformed policy document, missing key material,
 * invalid limits. Thrown from bean factories so the application context never starts.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.FATAL_CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.FATAL_CONFIGURATION, message, cause);
    }
}
