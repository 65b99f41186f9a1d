package com.openwash.common.exception;

/**
 * Malformed or out-of-range request data. The caller can fix the request and retry.
 */
public class InvalidInputException extends BusinessException {

    public static final String ERROR_CODE = "INVALID_INPUT";

    public InvalidInputException(String message) {
        super(message, ERROR_CODE);
    }
}
