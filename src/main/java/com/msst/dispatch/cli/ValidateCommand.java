package com.msst.dispatch.cli;

import com.msst.core.config.ConfigurationException;
import com.msst.core.config.EndpointConfig;
import com.msst.core.config.EndpointConfigLoader;
import com.msst.core.model.Suite;
import com.msst.core.model.TestResult;
import com.msst.core.model.ValidationReport;
import com.msst.core.report.ReportWriteException;
import com.msst.core.validation.SuiteCatalog;
import com.msst.core.validation.SuiteEvaluationService;
import com.msst.core.validation.ValidationListener;
import com.msst.core.validation.ValidationOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Callable;

/**
 * CLI command: msst validate --config FILE [--output-dir DIR] [--quick]
 * <p>
 * Runs the production validation suites, each test in its own child process.
 * Exit code 0 iff the endpoint is production ready, 1 when it is not, and 2 when
 * the run could not be carried out (missing or bad configuration, unwritable report).
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Run the S3 production validation suite")
@Component
public class ValidateCommand implements Callable<Integer> {

    static final int NOT_READY = 1;
    static final int BROKEN = 2;

    private static final DateTimeFormatter DIR_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    @Option(names = {"--config", "-c"}, required = true, description = "Path to S3 configuration file")
    private Path config;

    @Option(names = {"--output-dir", "-o"}, description = "Directory for validation results")
    private Path outputDir;

    @Option(names = "--quick", description = "Run only the quick suites (critical and error handling)")
    private boolean quick;

    private final EndpointConfigLoader configLoader;
    private final SuiteCatalog catalog;
    private final ValidationOrchestrator orchestrator;
    private final SuiteEvaluationService evaluation;

    public ValidateCommand(EndpointConfigLoader configLoader,
                           SuiteCatalog catalog,
                           ValidationOrchestrator orchestrator,
                           SuiteEvaluationService evaluation) {
        this.configLoader = configLoader;
        this.catalog = catalog;
        this.orchestrator = orchestrator;
        this.evaluation = evaluation;
    }

    @Override
    public Integer call() {
        SuiteCatalog suites = quick ? catalog.quick() : catalog;
        if (suites.isEmpty()) {
            ConsoleOutput.error("No validation suites configured");
            return BROKEN;
        }

        if (!Files.exists(config)) {
            ConsoleOutput.error("Configuration file not found: " + config);
            return BROKEN;
        }
        EndpointConfig endpoint;
        try {
            endpoint = configLoader.load(config);
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return BROKEN;
        }
        Path dir = outputDir != null
                ? outputDir
                : Path.of("validation-" + LocalDateTime.now().format(DIR_STAMP));

        System.out.println();
        System.out.println(ConsoleOutput.RULE);
        System.out.println("S3 PRODUCTION VALIDATION SUITE");
        System.out.println(ConsoleOutput.RULE);
        System.out.println("Endpoint: " + endpoint.endpointUrl());
        System.out.println("Vendor: " + endpoint.vendorType());
        System.out.println("Output: " + dir);
        System.out.println("Started: " + LocalDateTime.now());

        ValidationReport report;
        try {
            report = orchestrator.validate(suites, config, endpoint, dir, new ConsoleListener());
        } catch (ConfigurationException | ReportWriteException e) {
            ConsoleOutput.error(e.getMessage());
            return BROKEN;
        }

        ConsoleOutput.validationSummary(report, evaluation.unmetRequirements(report.suites(), report.summary()));
        ConsoleOutput.success("Reports saved to " + dir);
        return report.productionReady() ? 0 : NOT_READY;
    }

    private static final class ConsoleListener implements ValidationListener {

        @Override
        public void suiteStarted(Suite suite) {
            ConsoleOutput.suiteHeader(suite);
        }

        @Override
        public void testStarted(Suite suite, String testId) {
            ConsoleOutput.testRunning(testId);
        }

        @Override
        public void testCompleted(Suite suite, TestResult result) {
            ConsoleOutput.testOutcome(result);
        }
    }
}
