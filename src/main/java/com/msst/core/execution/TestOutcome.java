package com.msst.core.execution;

/**
 * Value a test unit's entry point may return instead of throwing.
 * A {@code void} entry point, or one returning {@code null}, counts as {@link Passed}.
 */
public sealed interface TestOutcome
        permits TestOutcome.Passed, TestOutcome.Skipped, TestOutcome.AssertionFailed, TestOutcome.Fault {

    record Passed() implements TestOutcome {}

    record Skipped(String reason) implements TestOutcome {}

    /** The unit's own correctness check did not hold. */
    record AssertionFailed(String message) implements TestOutcome {}

    /** Something unexpected went wrong outside the unit's assertions. */
    record Fault(String message, String trace) implements TestOutcome {}

    static TestOutcome passed() {
        return new Passed();
    }

    static TestOutcome skipped(String reason) {
        return new Skipped(reason);
    }

    static TestOutcome assertionFailed(String message) {
        return new AssertionFailed(message);
    }

    static TestOutcome fault(String message, String trace) {
        return new Fault(message, trace);
    }
}
