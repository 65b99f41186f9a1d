package com.openwash.common.exception;

/**
 * Referenced entity is missing or inactive.
 */
public class ResourceNotFoundException extends BusinessException {

    public static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String message) {
        super(message, ERROR_CODE);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), ERROR_CODE);
    }
}
