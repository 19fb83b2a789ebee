package com.msst.core.report;

import com.msst.core.model.TestResult;
import com.msst.core.model.TestRun;
import com.msst.core.model.TestSummary;

import java.util.List;

/**
 * Structured record of a run, shared by the JSON and YAML formatters and read back
 * by the validation orchestrator from a child's result file.
 */
public record ResultDocument(
    String timestamp,
    int total,
    int passed,
    int failed,
    int skipped,
    int errors,
    List<TestResult> results
) {

    public static ResultDocument of(TestRun run) {
        TestSummary summary = run.summary();
        return new ResultDocument(run.timestamp(), summary.total(), summary.passed(), summary.failed(),
                summary.skipped(), summary.errors(), run.results());
    }
}
