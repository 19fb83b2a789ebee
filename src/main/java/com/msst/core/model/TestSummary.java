package com.msst.core.model;

import java.util.List;

/**
 * Counts over a sequence of {@link TestResult}s. TIMEOUT outcomes are counted as
 * errors so that {@code passed + failed + skipped + errors == total} always holds.
 */
public record TestSummary(
    int total,
    int passed,
    int failed,
    int skipped,
    int errors
) {

    public static TestSummary of(List<TestResult> results) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int errors = 0;
        for (TestResult r : results) {
            switch (r.status()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                case ERROR, TIMEOUT -> errors++;
            }
        }
        return new TestSummary(results.size(), passed, failed, skipped, errors);
    }

    /** Percentage of {@code count} over {@link #total()}; callers must check {@code total > 0}. */
    public double percent(int count) {
        return count * 100.0 / total;
    }
}
