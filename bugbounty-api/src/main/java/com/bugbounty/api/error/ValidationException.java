package com.bugbounty.api.error;

/**
 * Thrown when a request is missing required input. Maps to 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
