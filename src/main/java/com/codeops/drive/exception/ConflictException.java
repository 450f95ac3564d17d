package com.codeops.drive.exception;

/**
 * Thrown when a folder name collides with a sibling under the same parent.
 * Maps to HTTP 409 Conflict.
 */
public class ConflictException extends DriveException {

    /**
     * Creates a new ConflictException with the specified message.
     *
     * @param message the detail message
     */
    public ConflictException(String message) {
        super(message);
    }
}
