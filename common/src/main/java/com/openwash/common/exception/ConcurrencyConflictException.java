package com.openwash.common.exception;

/**
 * Lost an allocation race: another transaction changed the resource schedule
 * between our check and our write. Retryable once.
 */
public class ConcurrencyConflictException extends BusinessException {

    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";

    public ConcurrencyConflictException(String message) {
        super(message, ERROR_CODE);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE);
    }
}
