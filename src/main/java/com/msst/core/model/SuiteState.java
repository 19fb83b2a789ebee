package com.msst.core.model;

/**
 * Lifecycle of a suite during a validation run.
 */
public enum SuiteState {
    NOT_STARTED,
    RUNNING,
    MEETS_REQUIREMENT,
    FAILS_REQUIREMENT;

    public boolean isTerminal() {
        return this == MEETS_REQUIREMENT || this == FAILS_REQUIREMENT;
    }
}
