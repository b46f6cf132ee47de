package com.bugbounty.api.error;

/**
 * Exception thrown when attempting to register with an existing email. Maps to 409.
 */
public class EmailAlreadyExistsException extends RuntimeException {

    public EmailAlreadyExistsException(String message) {
        super(message);
    }
}
