package com.servicebooking.common.exception;

/**
 * Unknown booking, request or offering id within the caller's tenant.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, "RESOURCE_NOT_FOUND");
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s %s not found", resourceType, identifier), "RESOURCE_NOT_FOUND");
    }
}
