package com.sandy.fleet.health.exception;

/**
 * Thrown when a forklift, reading, alert or webhook id does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {
    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String kind, Object id) {
        return new ResourceNotFoundException(kind + " not found: " + id);
    }
}
