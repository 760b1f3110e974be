package com.defiguard.exception;

/**
 * Raised when a tool call carries a missing, malformed, expired or revoked invocation token.
 * Never reaches the governance pipeline and is never audited as a policy block.
 */
public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILURE, message);
    }
}
