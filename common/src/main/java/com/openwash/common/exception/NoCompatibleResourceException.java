package com.openwash.common.exception;

/**
 * No active resource can serve the vehicle size or location at all, whatever the time.
 * Not transient: retrying with another time will not help.
 */
public class NoCompatibleResourceException extends BusinessException {

    public static final String ERROR_CODE = "NO_COMPATIBLE_RESOURCE";

    public NoCompatibleResourceException(String message) {
        super(message, ERROR_CODE);
    }
}
