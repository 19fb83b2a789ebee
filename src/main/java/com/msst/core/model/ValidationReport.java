package com.msst.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final answer of a validation run: per-suite results, totals and the readiness gate.
 * Written once to disk and never mutated afterwards.
 */
public record ValidationReport(
    String timestamp,
    EndpointInfo config,
    Map<String, SuiteResult> suites,
    ValidationSummary summary,
    boolean productionReady
) {
    public ValidationReport {
        suites = Collections.unmodifiableMap(new LinkedHashMap<>(suites));
    }
}
