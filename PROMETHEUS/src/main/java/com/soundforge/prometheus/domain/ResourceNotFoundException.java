package com.soundforge.prometheus.domain;

/**
 * Thrown when an operator references a rule, response or provider that is not registered.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " " + resourceId + " not found");
    }
}
