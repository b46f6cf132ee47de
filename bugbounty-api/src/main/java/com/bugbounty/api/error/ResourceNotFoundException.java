package com.bugbounty.api.error;

/**
 * Thrown when a resource id does not resolve. Maps to 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
