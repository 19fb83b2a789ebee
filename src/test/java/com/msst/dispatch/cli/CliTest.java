package com.msst.dispatch.cli;

import com.msst.core.config.EndpointConfigLoader;
import com.msst.core.discovery.TestArtifact;
import com.msst.core.discovery.TestDiscovery;
import com.msst.core.discovery.TestGroups;
import com.msst.core.execution.TestExecutor;
import com.msst.core.execution.TestExecutorFactory;
import com.msst.core.model.Suite;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestStatus;
import com.msst.core.model.TestUnit;
import com.msst.core.report.ResultWriter;
import com.msst.core.validation.ChildTestRunner;
import com.msst.core.validation.SuiteCatalog;
import com.msst.core.validation.SuiteEvaluationService;
import com.msst.core.validation.ValidationOrchestrator;
import com.msst.core.validation.ValidationReportWriter;
import com.msst.fixtures.units.basic.SampleBucketUnit;
import com.msst.fixtures.units.multipart.SampleUploadUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the msst CLI command structure.
 * These tests exercise picocli directly without Spring context, with mocked
 * executors and child test runners standing in for a live endpoint.
 */
class CliTest {

    private record CliResult(int exitCode, String output, String errors) {}

    @TempDir
    Path tempDir;

    private TestDiscovery discovery;
    private TestExecutor executor;
    private ChildTestRunner childRunner;
    private SuiteCatalog catalog;

    @BeforeEach
    void setUp() {
        discovery = new TestDiscovery(TestGroups.defaults(), namespace -> switch (namespace) {
            case "basic" -> List.of(new TestArtifact("basic", "16", "Sample bucket unit", SampleBucketUnit.class));
            case "multipart" -> List.of(new TestArtifact("multipart", "150", "", SampleUploadUnit.class));
            default -> List.of();
        });
        executor = mock(TestExecutor.class);
        childRunner = mock(ChildTestRunner.class);
        catalog = new SuiteCatalog(List.of(
                new Suite("critical", "Critical Data Integrity", List.of("016"), 100, "")),
                "critical", Set.of("critical"));
    }

    private void executorReturns(TestStatus status) {
        when(executor.execute(any())).thenAnswer(invocation -> {
            TestUnit unit = invocation.getArgument(0);
            return new TestResult(unit.id(), unit.name(), unit.group(), status, 0.1,
                    status == TestStatus.PASSED ? "Test passed successfully" : "Size mismatch", "", "t");
        });
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        TestExecutorFactory executorFactory = mock(TestExecutorFactory.class);
        when(executorFactory.create(any())).thenReturn(executor);
        var evaluation = new SuiteEvaluationService(null);
        var orchestrator = new ValidationOrchestrator(childRunner, evaluation, new ValidationReportWriter(), null);

        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(new EndpointConfigLoader(), discovery, executorFactory, new ResultWriter());
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(new EndpointConfigLoader(), catalog, orchestrator, evaluation);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(new PrintStream(out, true));
        System.setErr(new PrintStream(err, true));
        try {
            CommandLine commandLine = new CommandLine(new MsstCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            return new CliResult(exitCode, out.toString(), err.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("top-level command")
    class TopLevelTests {

        @Test
        @DisplayName("--help lists the run and validate subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("validate"));
            assertTrue(result.output().contains("S3 compatibility test harness"));
        }

        @Test
        @DisplayName("--version prints the harness version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("msst 1.0.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("MSST S3 COMPATIBILITY HARNESS"));
            assertTrue(result.output().contains("Usage: msst"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("--list-tests prints every discovered test")
        void listTests() {
            CliResult result = execute("run", "--list-tests");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Available tests:"));
            assertTrue(result.output().contains("  016: test_016 (basic)"));
            assertTrue(result.output().contains("  150: test_150 (multipart)"));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("unknown test ID exits 1 without running anything")
        void unknownTest() {
            CliResult result = execute("run", "--test", "999", "--config", tempDir.resolve("none.yaml").toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("Test 999 not found"));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("unknown group exits 1")
        void unknownGroup() {
            CliResult result = execute("run", "--group", "acl", "--config", tempDir.resolve("none.yaml").toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("No tests found in group acl"));
        }

        @Test
        @DisplayName("unsupported output format exits 1")
        void badFormat() {
            CliResult result = execute("run", "--output-format", "csv", "--config", tempDir.resolve("none.yaml").toString());

            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("a passing selection exits 0 and writes results in the requested format")
        void passingRun() throws Exception {
            executorReturns(TestStatus.PASSED);
            Path out = tempDir.resolve("results");
            Path resultFile = tempDir.resolve("tests/016/result.json");

            CliResult result = execute("run", "--test", "16", "--config", tempDir.resolve("none.yaml").toString(),
                    "--output-dir", out.toString(), "--output-format", "json",
                    "--result-file", resultFile.toString());

            assertEquals(0, result.exitCode());
            assertTrue(Files.exists(out.resolve("results.json")));
            assertTrue(Files.readString(resultFile).contains("\"test_id\" : \"016\""));
            assertTrue(result.output().contains("Results saved to"));
            assertTrue(result.output().contains("Total Tests: 1"));
            verify(executor).close();
        }

        @Test
        @DisplayName("a failing test makes the run exit 1")
        void failingRun() {
            executorReturns(TestStatus.FAILED);

            CliResult result = execute("run", "--group", "basic", "--config", tempDir.resolve("none.yaml").toString(),
                    "--output-dir", tempDir.resolve("results").toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Size mismatch"));
        }

        @Test
        @DisplayName("--verbose prints the indented trace of a failed test")
        void verboseTrace() {
            when(executor.execute(any())).thenAnswer(invocation -> {
                TestUnit unit = invocation.getArgument(0);
                return new TestResult(unit.id(), unit.name(), unit.group(), TestStatus.ERROR, 0.1, "boom",
                        "java.lang.IllegalStateException: boom\n\tat Unit.test016(Unit.java:12)", "t");
            });

            CliResult result = execute("run", "--test", "16", "--verbose",
                    "--config", tempDir.resolve("none.yaml").toString(),
                    "--output-dir", tempDir.resolve("results").toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("    java.lang.IllegalStateException: boom"));
            assertTrue(result.output().contains("Unit.java:12"));
        }

        @Test
        @DisplayName("without --verbose the trace stays out of the console")
        void quietTrace() {
            when(executor.execute(any())).thenAnswer(invocation -> {
                TestUnit unit = invocation.getArgument(0);
                return new TestResult(unit.id(), unit.name(), unit.group(), TestStatus.ERROR, 0.1, "boom",
                        "java.lang.IllegalStateException: boom\n\tat Unit.test016(Unit.java:12)", "t");
            });

            CliResult result = execute("run", "--test", "16",
                    "--config", tempDir.resolve("none.yaml").toString(),
                    "--output-dir", tempDir.resolve("results").toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("boom"));
            assertFalse(result.output().contains("Unit.java:12"));
        }

        @Test
        @DisplayName("without --test or --group the enabled groups of the configuration run")
        void enabledGroups() throws Exception {
            executorReturns(TestStatus.PASSED);
            Path config = tempDir.resolve("s3_config.yaml");
            Files.writeString(config, "s3_endpoint_url: http://minio:9000\ntest_basic: true\ntest_multipart: false\n");

            CliResult result = execute("run", "--config", config.toString(),
                    "--output-dir", tempDir.resolve("results").toString());

            assertEquals(0, result.exitCode());
            verify(executor, times(1)).execute(any());
            assertTrue(result.output().contains("Running 1 tests"));
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        private String configFile() throws Exception {
            Path config = tempDir.resolve("s3_config.yaml");
            Files.writeString(config, "s3_endpoint_url: http://minio:9000\nvendor_type: minio\n");
            return config.toString();
        }

        private void childReturns(TestStatus status) {
            when(childRunner.run(anyString(), any(), any())).thenAnswer(invocation -> {
                String id = invocation.getArgument(0);
                return new TestResult(id, "test_" + id, "basic", status, 0.3, "", "", "t");
            });
        }

        @Test
        @DisplayName("--config is required")
        void configRequired() {
            CliResult result = execute("validate");

            assertNotEquals(0, result.exitCode());
            assertTrue(result.errors().contains("--config"));
        }

        @Test
        @DisplayName("a ready endpoint exits 0 and both reports are written")
        void ready() throws Exception {
            childReturns(TestStatus.PASSED);
            Path out = tempDir.resolve("validation");

            CliResult result = execute("validate", "--config", configFile(),
                    "--output-dir", out.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("S3 PRODUCTION VALIDATION SUITE"));
            assertTrue(result.output().contains("Vendor: minio"));
            assertTrue(result.output().contains("PRODUCTION READY"));
            assertTrue(Files.exists(out.resolve(ValidationReportWriter.JSON_REPORT)));
            assertTrue(Files.exists(out.resolve(ValidationReportWriter.TEXT_REPORT)));
        }

        @Test
        @DisplayName("an endpoint that misses a requirement exits 1")
        void notReady() throws Exception {
            childReturns(TestStatus.TIMEOUT);

            CliResult result = execute("validate", "--config", configFile(),
                    "--output-dir", tempDir.resolve("validation").toString());

            assertEquals(ValidateCommand.NOT_READY, result.exitCode());
            assertTrue(result.output().contains("Failed requirements:"));
        }

        @Test
        @DisplayName("a missing configuration file exits 2")
        void missingConfig() {
            CliResult result = execute("validate", "--config", tempDir.resolve("none.yaml").toString(),
                    "--output-dir", tempDir.resolve("validation").toString());

            assertEquals(ValidateCommand.BROKEN, result.exitCode());
            assertTrue(result.errors().contains("Configuration file not found"));
            verifyNoInteractions(childRunner);
        }

        @Test
        @DisplayName("an empty suite table exits 2 without running anything")
        void emptyCatalog() throws Exception {
            catalog = new SuiteCatalog(List.of(), "critical", List.of());

            CliResult result = execute("validate", "--config", configFile(),
                    "--output-dir", tempDir.resolve("validation").toString());

            assertEquals(ValidateCommand.BROKEN, result.exitCode());
            assertTrue(result.errors().contains("No validation suites configured"));
            verifyNoInteractions(childRunner);
        }

        @Test
        @DisplayName("--quick runs only the quick suites")
        void quick() throws Exception {
            childReturns(TestStatus.PASSED);
            catalog = new SuiteCatalog(List.of(
                    new Suite("critical", "Critical", List.of("016"), 100, ""),
                    new Suite("performance", "Performance", List.of("150"), 90, "")),
                    "critical", Set.of("critical"));

            CliResult result = execute("validate", "--quick", "--config", configFile(),
                    "--output-dir", tempDir.resolve("validation").toString());

            assertEquals(0, result.exitCode());
            verify(childRunner).run(eq("016"), any(), any());
            verify(childRunner, never()).run(eq("150"), any(), any());
        }
    }
}
