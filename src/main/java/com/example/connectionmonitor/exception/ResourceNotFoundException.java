package com.example.connectionmonitor.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a schedule, connection or application that does not exist
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public ResourceNotFoundException(String resourceType, UUID resourceId) {
        this(resourceType, resourceId.toString());
    }
}
