package com.unievents.common.exception;

/**
 * The actor is not allowed to perform the operation. Never retried by callers.
 * Mapped to HTTP 403.
 */
public class ForbiddenException extends BusinessException {

    public ForbiddenException(String message) {
        super(message, "FORBIDDEN");
    }

    public ForbiddenException(String message, String errorCode) {
        super(message, errorCode);
    }
}
