package com.openwash.common.exception;

import lombok.Getter;

/**
 * A collaborator or the store did not answer in time, or the caller's deadline ran out.
 * Nothing was committed; the client may retry later.
 * Mapped to HTTP 503.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {

    private final String errorCode;

    public ServiceUnavailableException(String message) {
        this(message, null);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        this(message, cause, "SERVICE_UNAVAILABLE");
    }

    public ServiceUnavailableException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
