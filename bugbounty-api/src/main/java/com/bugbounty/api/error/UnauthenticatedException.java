package com.bugbounty.api.error;

/**
 * Thrown when no trusted identity can be established for a request. Maps to 401.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
