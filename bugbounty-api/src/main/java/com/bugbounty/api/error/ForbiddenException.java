package com.bugbounty.api.error;

/**
 * Thrown when an authenticated user lacks the role or ownership an operation needs. Maps to 403.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
