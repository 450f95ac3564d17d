package com.codeops.drive.exception;

/**
 * Base exception for all CodeOps-Drive service exceptions.
 * Maps to HTTP 500 Internal Server Error when not caught by a more specific handler.
 */
public class DriveException extends RuntimeException {

    /**
     * Creates a new DriveException with the specified message.
     *
     * @param message the detail message
     */
    public DriveException(String message) {
        super(message);
    }

    /**
     * Creates a new DriveException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the root cause
     */
    public DriveException(String message, Throwable cause) {
        super(message, cause);
    }
}
