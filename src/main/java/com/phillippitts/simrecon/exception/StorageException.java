package com.phillippitts.simrecon.exception;

/**
 * Thrown when the filesystem cannot satisfy a request: unique path exhaustion,
 * failure to force data to stable storage, or a failed workspace deletion.
 */
public class StorageException extends SimReconException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
