package com.msst.dispatch.cli;

import com.msst.core.config.ConfigurationException;
import com.msst.core.config.EndpointConfig;
import com.msst.core.config.EndpointConfigLoader;
import com.msst.core.discovery.TestDiscovery;
import com.msst.core.discovery.TestGroups;
import com.msst.core.execution.TestExecutor;
import com.msst.core.execution.TestExecutorFactory;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestRun;
import com.msst.core.model.TestUnit;
import com.msst.core.report.OutputFormat;
import com.msst.core.report.ReportWriteException;
import com.msst.core.report.ResultWriter;
import com.msst.core.report.TextResultFormatter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: msst run [--test ID | --group NAME]
 * <p>
 * Runs tests in-process, one after another, and writes {@code results.<ext>}.
 * Exit code 0 when nothing failed, errored or timed out; 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run S3 compatibility tests")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--config", "-c"}, defaultValue = "s3_config.yaml",
            description = "Endpoint configuration file (default: ${DEFAULT-VALUE})")
    private Path config;

    @Option(names = {"--test", "-t"}, description = "Run a specific test by ID (e.g. 001)")
    private String test;

    @Option(names = {"--group", "-g"}, description = "Run every test of a group")
    private String group;

    @Option(names = {"--output-dir", "-o"}, defaultValue = "results",
            description = "Output directory for results (default: ${DEFAULT-VALUE})")
    private Path outputDir;

    @Option(names = {"--output-format", "-f"}, defaultValue = "text",
            description = "Output format: json, yaml, text, junit (default: ${DEFAULT-VALUE})")
    private String outputFormat;

    @Option(names = {"--verbose", "-v"}, description = "Verbose output")
    private boolean verbose;

    @Option(names = {"--list-tests", "-l"}, description = "List available tests")
    private boolean listTests;

    @Option(names = "--result-file", hidden = true,
            description = "Also write the structured JSON record of the run to this file")
    private Path resultFile;

    private final EndpointConfigLoader configLoader;
    private final TestDiscovery discovery;
    private final TestExecutorFactory executorFactory;
    private final ResultWriter resultWriter;

    public RunCommand(EndpointConfigLoader configLoader,
                      TestDiscovery discovery,
                      TestExecutorFactory executorFactory,
                      ResultWriter resultWriter) {
        this.configLoader = configLoader;
        this.discovery = discovery;
        this.executorFactory = executorFactory;
        this.resultWriter = resultWriter;
    }

    @Override
    public Integer call() {
        if (listTests) {
            System.out.println("Available tests:");
            for (TestUnit unit : discovery.getAll()) {
                System.out.println("  " + unit.id() + ": " + unit.name() + " (" + unit.group() + ")");
            }
            return 0;
        }

        OutputFormat format;
        EndpointConfig endpoint;
        try {
            format = OutputFormat.fromValue(outputFormat);
            endpoint = configLoader.load(config);
        } catch (IllegalArgumentException | ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        Optional<List<TestUnit>> selection = select(endpoint);
        if (selection.isEmpty()) {
            return 1;
        }
        List<TestUnit> tests = selection.get();
        if (tests.isEmpty()) {
            ConsoleOutput.error("No tests to run");
            return 1;
        }

        String timestamp = LocalDateTime.now().toString();
        ConsoleOutput.info("Running " + tests.size() + " tests...");
        var results = new ArrayList<TestResult>();
        try (TestExecutor executor = executorFactory.create(endpoint)) {
            for (TestUnit unit : tests) {
                if (verbose) {
                    System.out.println("Running test " + unit.id() + ": " + unit.name() + " (" + unit.group() + ")...");
                }
                TestResult result = executor.execute(unit);
                results.add(result);
                ConsoleOutput.testResult(result, verbose);
            }
        }

        var run = new TestRun(timestamp, results);
        try {
            Path written = resultWriter.write(run, format, outputDir);
            if (resultFile != null) {
                resultWriter.writeStructured(run, resultFile);
            }
            System.out.println();
            ConsoleOutput.success("Results saved to " + written);
        } catch (ReportWriteException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (format != OutputFormat.TEXT) {
            System.out.println();
            System.out.println(new TextResultFormatter().format(run));
        }
        return results.stream().anyMatch(r -> r.status().isFailure()) ? 1 : 0;
    }

    /**
     * Tests selected by {@code --test}, {@code --group} or the enabled groups of the
     * endpoint configuration, sorted by ID. Empty when the selection is invalid.
     */
    private Optional<List<TestUnit>> select(EndpointConfig endpoint) {
        var selected = new ArrayList<TestUnit>();
        if (test != null) {
            Optional<TestUnit> unit = discovery.getById(test);
            if (unit.isEmpty()) {
                ConsoleOutput.error("Test " + test + " not found");
                return Optional.empty();
            }
            selected.add(unit.get());
        } else if (group != null) {
            selected.addAll(discovery.getByGroup(group));
            if (selected.isEmpty()) {
                ConsoleOutput.error("No tests found in group " + group);
                return Optional.empty();
            }
        } else {
            for (TestGroups.Range range : discovery.groups().ranges()) {
                if (endpoint.isGroupEnabled(range.name())) {
                    selected.addAll(discovery.getByGroup(range.name()));
                }
            }
        }
        selected.sort(Comparator.comparingInt(TestUnit::numericId));
        return Optional.of(selected);
    }
}
