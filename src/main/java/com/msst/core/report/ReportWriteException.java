package com.msst.core.report;

/**
 * Thrown when a result or report file cannot be written.
 */
public class ReportWriteException extends RuntimeException {
    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
