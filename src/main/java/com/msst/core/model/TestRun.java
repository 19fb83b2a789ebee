package com.msst.core.model;

import java.util.List;

/**
 * A frozen sequence of results together with the time the run started.
 * Formatters render only what is captured here, so rendering is repeatable.
 */
public record TestRun(
    String timestamp,
    List<TestResult> results
) {
    public TestRun {
        results = List.copyOf(results);
    }

    public TestSummary summary() {
        return TestSummary.of(results);
    }
}
