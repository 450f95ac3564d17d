package com.codeops.drive.exception;

/**
 * Standard error response body returned by all exception handlers.
 *
 * @param success always {@code false} for errors
 * @param status  the HTTP status code
 * @param message the human-readable error message
 */
public record ErrorResponse(boolean success, int status, String message) {

    public ErrorResponse(int status, String message) {
        this(false, status, message);
    }
}
