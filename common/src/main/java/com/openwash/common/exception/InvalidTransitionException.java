package com.openwash.common.exception;

/**
 * Requested status change is not allowed from the current status.
 */
public class InvalidTransitionException extends BusinessException {

    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String message) {
        super(message, ERROR_CODE);
    }
}
