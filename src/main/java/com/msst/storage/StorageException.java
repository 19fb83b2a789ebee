package com.msst.storage;

/**
 * Typed fault raised by {@link S3StorageClient}, carrying the service's
 * machine-readable error code (e.g. {@code NoSuchKey}) and HTTP status.
 */
public class StorageException extends RuntimeException {

    private final String errorCode;
    private final int statusCode;

    public StorageException(String message, String errorCode, int statusCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /** HTTP status of the failed request, or 0 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
