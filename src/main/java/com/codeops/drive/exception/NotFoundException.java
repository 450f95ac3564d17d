package com.codeops.drive.exception;

/**
 * Thrown when a requested resource does not exist or is not visible to the caller.
 * Maps to HTTP 404 Not Found.
 */
public class NotFoundException extends DriveException {

    /**
     * Creates a new NotFoundException with the specified message.
     *
     * @param message the detail message
     */
    public NotFoundException(String message) {
        super(message);
    }
}
