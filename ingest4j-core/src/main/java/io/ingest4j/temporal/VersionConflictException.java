package io.ingest4j.temporal;

/**
 * A conditional write lost against a concurrent writer on the same natural key.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
