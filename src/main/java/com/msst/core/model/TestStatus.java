package com.msst.core.model;

/**
 * Terminal status of a single test execution. Decided once, at completion.
 */
public enum TestStatus {
    PASSED,
    FAILED,   // the unit's own assertion did not hold
    ERROR,    // unexpected fault outside the unit's assertions
    SKIPPED,
    TIMEOUT;

    /** Status glyph used by the text report and console output. */
    public String glyph() {
        return switch (this) {
            case PASSED -> "✓";
            case FAILED -> "✗";
            case SKIPPED -> "○";
            case ERROR -> "!";
            case TIMEOUT -> "⏱";
        };
    }

    /** True for outcomes that count against a run's exit code. */
    public boolean isFailure() {
        return this == FAILED || this == ERROR || this == TIMEOUT;
    }
}
