package com.codeops.drive.exception;

/**
 * Thrown when an upload exceeds the configured maximum file size.
 * Maps to HTTP 413 Payload Too Large.
 */
public class PayloadTooLargeException extends DriveException {

    /**
     * Creates a new PayloadTooLargeException with the specified message.
     *
     * @param message the detail message
     */
    public PayloadTooLargeException(String message) {
        super(message);
    }
}
