package com.msst.core.model;

/**
 * Run-wide totals of a validation report.
 */
public record ValidationSummary(
    int totalTests,
    int passed,
    int failed,
    int skipped,
    int errors,
    double overallPassRate,
    boolean criticalTestsPassed
) {}
