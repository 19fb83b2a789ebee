package com.msst.core.execution;

/**
 * Thrown by a test unit that declines to run, e.g. because the feature it
 * covers is not applicable to the endpoint.
 */
public class TestSkippedException extends RuntimeException {
    public TestSkippedException(String reason) {
        super(reason);
    }
}
