package com.msst.core.validation;

import com.msst.core.config.MsstProperties;
import com.msst.core.discovery.TestDiscovery;
import com.msst.core.discovery.TestIds;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestStatus;
import com.msst.core.model.TestUnit;
import com.msst.core.report.JsonResultFormatter;
import com.msst.core.report.ResultDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Runs one test in an isolated child process under a wall-clock bound and turns
 * whatever happened into a {@link TestResult}.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>bound exceeded: the child is killed and the result is TIMEOUT with the bound as duration</li>
 *   <li>the child wrote a structured result for the test: that result is used as is</li>
 *   <li>exit code 0: PASSED</li>
 *   <li>otherwise ERROR, with the first output line mentioning ERROR or FAILED as message</li>
 * </ol>
 * A child that cannot be spawned is reported as ERROR. This method never throws.
 */
@Service
public class ChildTestRunner {

    private static final Logger log = LoggerFactory.getLogger(ChildTestRunner.class);

    static final String RESULT_FILE = "result.json";

    private final TestProcessLauncher launcher;
    private final TestDiscovery discovery;
    private final Duration timeout;
    private final JsonResultFormatter json = new JsonResultFormatter();

    @Autowired
    public ChildTestRunner(TestProcessLauncher launcher, TestDiscovery discovery, MsstProperties properties) {
        this(launcher, discovery, Duration.ofSeconds(properties.getValidation().getTimeoutSeconds()));
    }

    public ChildTestRunner(TestProcessLauncher launcher, TestDiscovery discovery, Duration timeout) {
        this.launcher = launcher;
        this.discovery = discovery;
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * @param testId     test ID in any padding
     * @param configFile endpoint configuration handed to the child
     * @param outputDir  validation output directory; the child works in {@code tests/<id>} below it
     */
    public TestResult run(String testId, Path configFile, Path outputDir) {
        String id = TestIds.normalize(testId).orElse(testId);
        Optional<TestUnit> unit = discovery.getById(id);
        String name = unit.map(TestUnit::name).orElse("test_" + id);
        String group = unit.map(TestUnit::group).orElse("unknown");

        Path workDir = outputDir.resolve("tests").resolve(id);
        Path resultFile = workDir.resolve(RESULT_FILE);
        String timestamp = LocalDateTime.now().toString();
        long start = System.nanoTime();

        String handle;
        try {
            Files.deleteIfExists(resultFile);
            handle = launcher.launch(new ChildTestRequest(id, configFile, workDir, resultFile));
        } catch (IOException | RuntimeException e) {
            log.error("Cannot launch test {}: {}", id, e.getMessage());
            return new TestResult(id, name, group, TestStatus.ERROR, elapsed(start),
                    "Test error: cannot launch test process: " + e.getMessage(), e.toString(), timestamp);
        }

        try {
            OptionalInt exit = launcher.waitForCompletion(handle, timeout);
            if (exit.isEmpty()) {
                log.warn("Test {} exceeded {}s, terminating", id, timeout.toSeconds());
                return new TestResult(id, name, group, TestStatus.TIMEOUT, timeout.toMillis() / 1000.0,
                        "Test timeout (>" + timeout.toSeconds() + " seconds)", "", timestamp);
            }
            double duration = elapsed(start);
            int exitCode = exit.getAsInt();

            Optional<TestResult> reported = readResult(resultFile, id);
            if (reported.isPresent()) {
                return reported.get();
            }
            if (exitCode == 0) {
                return new TestResult(id, name, group, TestStatus.PASSED, duration,
                        "Test passed successfully", "", timestamp);
            }
            String output = launcher.captureOutput(handle);
            return new TestResult(id, name, group, TestStatus.ERROR, duration,
                    errorLine(output).orElse("Test process exited with code " + exitCode), output, timestamp);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new TestResult(id, name, group, TestStatus.ERROR, elapsed(start),
                    "Test error: interrupted while waiting for test process", "", timestamp);
        } finally {
            launcher.teardown(handle);
        }
    }

    private Optional<TestResult> readResult(Path resultFile, String id) {
        if (!Files.exists(resultFile)) {
            return Optional.empty();
        }
        try {
            ResultDocument document = json.parse(Files.readString(resultFile, StandardCharsets.UTF_8));
            if (document.results() == null) {
                return Optional.empty();
            }
            return document.results().stream()
                    .filter(r -> id.equals(r.testId()))
                    .findFirst();
        } catch (IOException e) {
            log.warn("Ignoring unreadable result file {}: {}", resultFile, e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> errorLine(String output) {
        if (output == null) {
            return Optional.empty();
        }
        return output.lines()
                .filter(line -> line.contains("ERROR") || line.contains("FAILED"))
                .map(String::strip)
                .findFirst();
    }

    private static double elapsed(long startNanos) {
        return Math.max(0, (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }
}
