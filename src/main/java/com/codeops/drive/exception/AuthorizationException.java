package com.codeops.drive.exception;

/**
 * Thrown when the caller is authenticated but is neither the owner nor a grantee of the target.
 * Maps to HTTP 403 Forbidden.
 */
public class AuthorizationException extends DriveException {

    /**
     * Creates a new AuthorizationException with the specified message.
     *
     * @param message the detail message
     */
    public AuthorizationException(String message) {
        super(message);
    }
}
