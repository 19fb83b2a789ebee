package com.msst.core.validation;

import com.msst.core.metrics.MsstMetrics;
import com.msst.core.model.Suite;
import com.msst.core.model.SuiteResult;
import com.msst.core.model.SuiteState;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestSummary;
import com.msst.core.model.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates suites against their required pass rates and computes the
 * production-readiness gate.
 * <p>
 * An endpoint is production ready when every suite meets its requirement, the
 * critical suite explicitly meets its requirement, and the overall pass rate is
 * at least {@value #READINESS_PASS_RATE}%.
 */
@Service
public class SuiteEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(SuiteEvaluationService.class);

    /** Minimum overall pass rate (inclusive) for production readiness. */
    public static final double READINESS_PASS_RATE = 95.0;

    private final MsstMetrics metrics;

    public SuiteEvaluationService(@Autowired(required = false) MsstMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Evaluates a suite from its per-test results.
     * <p>
     * A suite without tests has a pass rate of 0, so it fails any non-zero requirement.
     */
    public SuiteResult evaluate(Suite suite, List<TestResult> results) {
        TestSummary summary = TestSummary.of(results);
        double passRate = summary.total() > 0 ? summary.percent(summary.passed()) : 0.0;
        boolean meets = passRate >= suite.requiredPassRate();
        if (summary.total() == 0) {
            log.warn("Suite {} has no tests; pass rate 0 against required {}%", suite.key(), suite.requiredPassRate());
        }

        var result = new SuiteResult(suite.key(), suite.name(), suite.description(), suite.requiredPassRate(),
                results, summary.passed(), summary.failed(), summary.skipped(), summary.errors(),
                passRate, meets, meets ? SuiteState.MEETS_REQUIREMENT : SuiteState.FAILS_REQUIREMENT);

        log.info("Suite {} {}: {}/{} passed ({}%, required {}%)", suite.key(),
                meets ? "MEETS requirement" : "FAILS requirement",
                summary.passed(), summary.total(), String.format(Locale.ROOT, "%.1f", passRate), suite.requiredPassRate());
        if (metrics != null) {
            metrics.recordSuiteEvaluation(suite.key(), meets);
        }
        return result;
    }

    public ValidationSummary summarize(Map<String, SuiteResult> suites, String criticalKey) {
        int total = 0;
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int errors = 0;
        for (SuiteResult s : suites.values()) {
            total += s.total();
            passed += s.passed();
            failed += s.failed();
            skipped += s.skipped();
            errors += s.errors();
        }
        double overall = total > 0 ? passed * 100.0 / total : 0.0;
        SuiteResult critical = suites.get(criticalKey);
        boolean criticalPassed = critical != null && critical.meetsRequirement();
        if (critical == null) {
            log.warn("Critical suite '{}' was not part of this run", criticalKey);
        }
        return new ValidationSummary(total, passed, failed, skipped, errors, overall, criticalPassed);
    }

    public boolean isProductionReady(Map<String, SuiteResult> suites, ValidationSummary summary) {
        boolean allSuitesMet = suites.values().stream().allMatch(SuiteResult::meetsRequirement);
        boolean ready = allSuitesMet
                && summary.criticalTestsPassed()
                && summary.overallPassRate() >= READINESS_PASS_RATE;
        log.info("Production readiness: {} (all suites met: {}, critical met: {}, overall {}%)",
                ready, allSuitesMet, summary.criticalTestsPassed(),
                String.format(Locale.ROOT, "%.1f", summary.overallPassRate()));
        return ready;
    }

    /** Human-readable reasons a report is not production ready; empty when it is. */
    public List<String> unmetRequirements(Map<String, SuiteResult> suites, ValidationSummary summary) {
        var reasons = new ArrayList<String>();
        for (SuiteResult s : suites.values()) {
            if (!s.meetsRequirement()) {
                reasons.add(String.format(Locale.ROOT, "%s: %.1f%% (required: %s%%)",
                        s.name(), s.passRate(), formatRate(s.requiredPassRate())));
            }
        }
        if (!summary.criticalTestsPassed() && suites.values().stream().allMatch(SuiteResult::meetsRequirement)) {
            reasons.add("Critical suite did not run or did not meet its requirement");
        }
        if (summary.overallPassRate() < READINESS_PASS_RATE) {
            reasons.add(String.format(Locale.ROOT, "Overall pass rate %.1f%% (required: %s%%)",
                    summary.overallPassRate(), formatRate(READINESS_PASS_RATE)));
        }
        return reasons;
    }

    static String formatRate(double rate) {
        return rate == Math.rint(rate) ? String.valueOf((long) rate) : String.valueOf(rate);
    }
}
