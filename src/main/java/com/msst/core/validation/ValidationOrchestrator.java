package com.msst.core.validation;

import com.msst.core.config.ConfigurationException;
import com.msst.core.config.EndpointConfig;
import com.msst.core.logging.MdcContext;
import com.msst.core.metrics.MsstMetrics;
import com.msst.core.model.EndpointInfo;
import com.msst.core.model.Suite;
import com.msst.core.model.SuiteResult;
import com.msst.core.model.SuiteState;
import com.msst.core.model.TestResult;
import com.msst.core.model.ValidationReport;
import com.msst.core.model.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers "is this endpoint production ready?" for a table of suites.
 * <p>
 * Suites run sequentially in table order; each test of a suite runs in its own
 * child process via {@link ChildTestRunner}. A suite moves
 * NOT_STARTED → RUNNING → MEETS_REQUIREMENT | FAILS_REQUIREMENT; a suite without
 * tests goes straight to its terminal state. A failing test never aborts the run.
 */
@Service
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    private final ChildTestRunner runner;
    private final SuiteEvaluationService evaluation;
    private final ValidationReportWriter reportWriter;
    private final MsstMetrics metrics;

    public ValidationOrchestrator(ChildTestRunner runner,
                                  SuiteEvaluationService evaluation,
                                  ValidationReportWriter reportWriter,
                                  @Autowired(required = false) MsstMetrics metrics) {
        this.runner = runner;
        this.evaluation = evaluation;
        this.reportWriter = reportWriter;
        this.metrics = metrics;
    }

    /**
     * Runs every suite of {@code catalog}, writes both report files into
     * {@code outputDir} and returns the report.
     *
     * @throws ConfigurationException when the catalog has no suites
     */
    public ValidationReport validate(SuiteCatalog catalog, Path configFile, EndpointConfig endpoint,
                                     Path outputDir, ValidationListener listener) {
        if (catalog.isEmpty()) {
            throw new ConfigurationException("No validation suites configured");
        }
        String timestamp = LocalDateTime.now().toString();
        log.info("Starting validation of {} ({}) with {} suites",
                endpoint.endpointUrl(), endpoint.vendorType(), catalog.suites().size());

        var states = new LinkedHashMap<String, SuiteState>();
        catalog.suites().forEach(s -> states.put(s.key(), SuiteState.NOT_STARTED));

        Map<String, SuiteResult> results = new LinkedHashMap<>();
        try {
            for (Suite suite : catalog.suites()) {
                MdcContext.setSuite(suite.key());
                listener.suiteStarted(suite);
                SuiteResult result = runSuite(suite, configFile, outputDir, states, listener);
                results.put(suite.key(), result);
                listener.suiteCompleted(result);
            }
        } finally {
            MdcContext.clear();
        }

        ValidationSummary summary = evaluation.summarize(results, catalog.criticalKey());
        boolean ready = evaluation.isProductionReady(results, summary);
        var report = new ValidationReport(timestamp,
                new EndpointInfo(endpoint.endpointUrl(), endpoint.vendorType()), results, summary, ready);

        reportWriter.write(report, outputDir);
        if (metrics != null) {
            metrics.recordValidation(ready);
        }
        listener.validationCompleted(report);
        log.info("Validation finished: {}", ready ? "PRODUCTION READY" : "NOT PRODUCTION READY");
        return report;
    }

    private SuiteResult runSuite(Suite suite, Path configFile, Path outputDir,
                                 Map<String, SuiteState> states, ValidationListener listener) {
        var testResults = new ArrayList<TestResult>();
        if (!suite.testIds().isEmpty()) {
            transition(suite, SuiteState.RUNNING, states, listener);
            for (String testId : suite.testIds()) {
                MdcContext.setTest(testId);
                try {
                    listener.testStarted(suite, testId);
                    TestResult result = runner.run(testId, configFile, outputDir);
                    testResults.add(result);
                    listener.testCompleted(suite, result);
                } finally {
                    MdcContext.clearTest();
                }
            }
        }
        SuiteResult result = evaluation.evaluate(suite, testResults);
        transition(suite, result.state(), states, listener);
        return result;
    }

    private static void transition(Suite suite, SuiteState next, Map<String, SuiteState> states,
                                   ValidationListener listener) {
        SuiteState current = states.get(suite.key());
        if (current.isTerminal()) {
            throw new IllegalStateException("Suite " + suite.key() + " already finished as " + current);
        }
        states.put(suite.key(), next);
        log.debug("Suite {}: {} -> {}", suite.key(), current, next);
        listener.suiteStateChanged(suite, next);
    }
}
