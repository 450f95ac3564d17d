package com.codeops.drive.exception;

/**
 * Thrown when a public link still exists but has passed its expiry time.
 * Maps to HTTP 410 Gone.
 */
public class GoneException extends DriveException {

    /**
     * Creates a new GoneException with the specified message.
     *
     * @param message the detail message
     */
    public GoneException(String message) {
        super(message);
    }
}
