package com.unievents.common.exception;

/**
 * A precondition on current state does not hold (full, already registered, already cancelled...).
 * The caller can recover by choosing a different action. Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
