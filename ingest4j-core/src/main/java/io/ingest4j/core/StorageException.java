package io.ingest4j.core;

/**
 * Raised when the storage backend fails (connection loss, constraint violation, ...).
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
