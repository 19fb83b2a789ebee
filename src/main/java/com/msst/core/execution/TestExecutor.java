package com.msst.core.execution;

import com.msst.core.config.EndpointConfig;
import com.msst.core.logging.MdcContext;
import com.msst.core.metrics.MsstMetrics;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestStatus;
import com.msst.core.model.TestUnit;
import com.msst.storage.S3StorageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Executes exactly one {@link TestUnit} in-process and classifies the outcome.
 * <p>
 * Classification:
 * <ul>
 *   <li>normal return (or {@link TestOutcome.Passed}) → PASSED</li>
 *   <li>{@link AssertionError} or {@link TestOutcome.AssertionFailed} → FAILED</li>
 *   <li>{@link TestSkippedException} or {@link TestOutcome.Skipped} → SKIPPED</li>
 *   <li>anything else, including a missing entry point → ERROR</li>
 * </ul>
 * No timeout is enforced here; a hung unit blocks the caller. Bounded execution is
 * the job of the validation orchestrator, which runs each test in a child process.
 * The executor never throws. Closing it closes the storage client.
 */
public class TestExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestExecutor.class);

    static final String PASSED_MESSAGE = "Test passed successfully";

    private final S3StorageClient client;
    private final EndpointConfig config;
    private final MsstMetrics metrics;

    public TestExecutor(S3StorageClient client, EndpointConfig config, MsstMetrics metrics) {
        this.client = client;
        this.config = config;
        this.metrics = metrics;
    }

    public TestResult execute(TestUnit unit) {
        String timestamp = LocalDateTime.now().toString();
        long start = System.nanoTime();
        MdcContext.setTest(unit.id());
        try {
            log.debug("Executing test {} ({})", unit.id(), unit.location().getName());
            TestResult result = classify(unit, timestamp, start);
            log.info("Test {} {} in {}s", unit.id(), result.status(), String.format(Locale.ROOT, "%.3f", result.duration()));
            if (metrics != null) {
                metrics.recordTest(unit.group(), result.status().name(), result.duration());
            }
            return result;
        } finally {
            MdcContext.clearTest();
        }
    }

    private TestResult classify(TestUnit unit, String timestamp, long start) {
        try {
            TestOutcome outcome = invoke(unit);
            return fromOutcome(unit, outcome, timestamp, elapsed(start));
        } catch (InvocationTargetException e) {
            return fromThrowable(unit, e.getCause() != null ? e.getCause() : e, timestamp, elapsed(start));
        } catch (Throwable t) {
            return fromThrowable(unit, t, timestamp, elapsed(start));
        }
    }

    private TestOutcome invoke(TestUnit unit) throws ReflectiveOperationException {
        Optional<Method> entry = EntryPoints.resolve(unit.location(), unit.id());
        if (entry.isEmpty()) {
            throw new NoSuchMethodException("No test method '" + EntryPoints.conventionalName(unit.id())
                    + "' or '" + EntryPoints.FALLBACK + "' found in " + unit.location().getName());
        }
        Method method = entry.get();
        Object target = Modifier.isStatic(method.getModifiers())
                ? null
                : unit.location().getDeclaredConstructor().newInstance();
        Object returned = method.invoke(target, client, config);
        return returned instanceof TestOutcome outcome ? outcome : TestOutcome.passed();
    }

    private static TestResult fromOutcome(TestUnit unit, TestOutcome outcome, String timestamp, double duration) {
        if (outcome instanceof TestOutcome.AssertionFailed failed) {
            String message = failed.message() != null ? failed.message() : "Assertion failed";
            return result(unit, TestStatus.FAILED, duration, message,
                    "AssertionFailed in " + unit.location().getName() + ": " + message, timestamp);
        }
        if (outcome instanceof TestOutcome.Fault fault) {
            return result(unit, TestStatus.ERROR, duration, "Test error: " + fault.message(),
                    fault.trace() != null ? fault.trace() : fault.message(), timestamp);
        }
        if (outcome instanceof TestOutcome.Skipped skipped) {
            return result(unit, TestStatus.SKIPPED, duration, skipped.reason(), "", timestamp);
        }
        return result(unit, TestStatus.PASSED, duration, PASSED_MESSAGE, "", timestamp);
    }

    private static TestResult fromThrowable(TestUnit unit, Throwable t, String timestamp, double duration) {
        if (t instanceof AssertionError) {
            String message = t.getMessage() != null ? t.getMessage() : "Assertion failed";
            return result(unit, TestStatus.FAILED, duration, message, stackTrace(t), timestamp);
        }
        if (t instanceof TestSkippedException) {
            return result(unit, TestStatus.SKIPPED, duration, t.getMessage(), "", timestamp);
        }
        log.debug("Test {} raised {}", unit.id(), t.toString());
        return result(unit, TestStatus.ERROR, duration, "Test error: " + describe(t), stackTrace(t), timestamp);
    }

    private static TestResult result(TestUnit unit, TestStatus status, double duration,
                                     String message, String error, String timestamp) {
        return new TestResult(unit.id(), unit.name(), unit.group(), status, duration, message, error, timestamp);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    static String stackTrace(Throwable t) {
        var out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    @Override
    public void close() {
        client.close();
    }

    private static double elapsed(long startNanos) {
        return Math.max(0, (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }
}
