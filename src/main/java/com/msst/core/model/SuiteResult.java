package com.msst.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Evaluated outcome of one {@link Suite}. Derived from the per-test results on every run.
 */
public record SuiteResult(
    String key,
    String name,
    String description,
    double requiredPassRate,
    List<TestResult> tests,
    int passed,
    int failed,
    int skipped,
    int errors,
    double passRate,
    boolean meetsRequirement,
    SuiteState state
) {
    public SuiteResult {
        tests = List.copyOf(tests);
    }

    @JsonProperty("total")
    public int total() {
        return tests.size();
    }
}
