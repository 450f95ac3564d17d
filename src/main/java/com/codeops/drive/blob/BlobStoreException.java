package com.codeops.drive.blob;

import com.codeops.drive.exception.DriveException;

/**
 * Thrown when the blob backend cannot complete an operation.
 * Maps to HTTP 500 with a generic "storage backend unavailable" message.
 */
public class BlobStoreException extends DriveException {

    public BlobStoreException(String message) {
        super(message);
    }

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
