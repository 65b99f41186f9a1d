package com.openwash.common.exception;

import lombok.Getter;

/**
 * Base type for every booking and capacity rule violation.
 * Subclasses fix the error code; the REST layer maps codes to HTTP statuses.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
