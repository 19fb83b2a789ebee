package com.msst.core.report;

import com.msst.core.discovery.TestIds;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestRun;
import com.msst.core.model.TestSummary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable report: header, summary with percentages, then one line per
 * result sorted by test ID. Non-passing results carry their message on an
 * indented continuation line.
 */
public class TextResultFormatter implements ResultFormatter {

    static final String HEAVY_RULE = "=".repeat(80);
    static final String LIGHT_RULE = "-".repeat(80);

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.TEXT;
    }

    @Override
    public String format(TestRun run) {
        TestSummary summary = run.summary();
        var lines = new ArrayList<String>();
        lines.add(HEAVY_RULE);
        lines.add("S3 Test Results Summary");
        lines.add(HEAVY_RULE);
        lines.add("Timestamp: " + run.timestamp());
        lines.add("");

        lines.add("Total Tests: " + summary.total());
        lines.add(countLine("Passed", summary.passed(), summary));
        lines.add(countLine("Failed", summary.failed(), summary));
        lines.add(countLine("Skipped", summary.skipped(), summary));
        lines.add(countLine("Errors", summary.errors(), summary));
        lines.add("");

        lines.add(LIGHT_RULE);
        lines.add("Test Results:");
        lines.add(LIGHT_RULE);

        List<TestResult> sorted = new ArrayList<>(run.results());
        sorted.sort(Comparator.<TestResult>comparingInt(r -> TestIds.parse(r.testId()).orElse(Integer.MAX_VALUE))
                .thenComparing(TestResult::testId));
        for (TestResult r : sorted) {
            lines.add(String.format(Locale.ROOT, "[%s] %s: %s (%s) - %s [%.3fs]",
                    r.status().glyph(), r.testId(), r.testName(), r.testGroup(), r.status(), r.duration()));
            if (!r.passed() && !r.message().isEmpty()) {
                lines.add("    " + r.message());
            }
        }
        lines.add(HEAVY_RULE);
        return String.join("\n", lines);
    }

    private static String countLine(String label, int count, TestSummary summary) {
        if (summary.total() == 0) {
            return label + ": " + count;
        }
        return String.format(Locale.ROOT, "%s: %d (%.1f%%)", label, count, summary.percent(count));
    }
}
