package com.codeops.drive.exception;

/**
 * Thrown when a request fails business validation rules.
 * Maps to HTTP 400 Bad Request.
 */
public class ValidationException extends DriveException {

    /**
     * Creates a new ValidationException with the specified message.
     *
     * @param message the detail message
     */
    public ValidationException(String message) {
        super(message);
    }
}
