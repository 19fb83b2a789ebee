package com.msst.dispatch.cli;

import com.msst.core.model.Suite;
import com.msst.core.model.SuiteResult;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestStatus;
import com.msst.core.model.ValidationReport;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the msst CLI.
 */
public class ConsoleOutput {

    static final String RULE = "=".repeat(80);

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MSST S3 COMPATIBILITY HARNESS v1.0.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MSST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Immediate feedback line of the test runner. */
    public static void testResult(TestResult result, boolean verbose) {
        if (!verbose && result.status() == TestStatus.PASSED) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "[@|" + color(result.status()) + " " + result.status().glyph() + "|@] Test "
                        + result.testId() + ": " + result.status()));
        if (result.status() != TestStatus.PASSED && !result.message().isEmpty()) {
            System.out.println("  " + result.message());
        }
        if (verbose && result.status() != TestStatus.PASSED && !result.error().isEmpty()) {
            result.error().lines().forEach(line -> System.out.println("    " + line));
        }
    }

    public static void suiteHeader(Suite suite) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + suite.name() + "|@"));
        System.out.println("  " + suite.description());
        System.out.println("  Tests: " + String.join(", ", suite.testIds()));
        System.out.printf(Locale.ROOT, "  Required pass rate: %s%%%n", formatRate(suite.requiredPassRate()));
    }

    public static void testRunning(String testId) {
        System.out.print("  Running test " + testId + "...");
        System.out.flush();
    }

    public static void testOutcome(TestResult result) {
        if (result.passed()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    String.format(Locale.ROOT, " @|fg(green) ✓ PASSED|@ (%.2fs)", result.duration())));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    " @|" + color(result.status()) + " " + result.status().glyph() + " "
                            + result.status() + "|@ - " + result.message()));
        }
    }

    public static void validationSummary(ValidationReport report, List<String> unmet) {
        System.out.println();
        System.out.println(RULE);
        System.out.println("VALIDATION SUMMARY");
        System.out.println(RULE);
        for (SuiteResult suite : report.suites().values()) {
            String mark = suite.meetsRequirement() ? "@|fg(green) ✓|@" : "@|fg(red) ✗|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT, "%s %s: %.1f%% (%d/%d passed)",
                    mark, suite.name(), suite.passRate(), suite.passed(), suite.total())));
        }
        System.out.println();
        System.out.println("-".repeat(40));
        System.out.printf(Locale.ROOT, "Overall: %.1f%% passed%n", report.summary().overallPassRate());
        System.out.println("Total tests: " + report.summary().totalTests());
        System.out.println("Passed: " + report.summary().passed());
        System.out.println("Failed: " + report.summary().failed());
        System.out.println("Skipped: " + report.summary().skipped());
        System.out.println("Errors: " + report.summary().errors());
        System.out.println();
        System.out.println(RULE);
        if (report.productionReady()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold ✓ PRODUCTION READY|@ - All requirements met"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold ✗ NOT PRODUCTION READY|@ - Some requirements not met"));
            System.out.println();
            System.out.println("Failed requirements:");
            for (String reason : unmet) {
                System.out.println("  - " + reason);
            }
        }
        System.out.println(RULE);
    }

    private static String color(TestStatus status) {
        return switch (status) {
            case PASSED -> "fg(green)";
            case SKIPPED -> "fg(cyan)";
            case TIMEOUT -> "fg(yellow)";
            case FAILED, ERROR -> "fg(red)";
        };
    }

    private static String formatRate(double rate) {
        return rate == Math.rint(rate) ? String.valueOf((long) rate) : String.valueOf(rate);
    }
}
