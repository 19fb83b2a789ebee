package com.msst.core.validation;

import com.msst.MsstApplication;
import com.msst.core.config.MsstProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs each test in a fresh JVM executing {@code msst run --test <id>}.
 * <p>
 * By default the child reuses the current JVM binary and class path; when the
 * class path is a single jar (the packaged application) it is started with
 * {@code -jar}. {@code msst.validation.java-command} overrides the command prefix.
 * The child's combined stdout/stderr goes to {@code output.log} in its work directory.
 */
@Component
public class ChildProcessLauncher implements TestProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ChildProcessLauncher.class);

    static final String OUTPUT_LOG = "output.log";

    private record Child(Process process, Path outputLog) {}

    private final List<String> commandPrefix;
    private final Map<String, Child> children = new ConcurrentHashMap<>();

    @Autowired
    public ChildProcessLauncher(MsstProperties properties) {
        this(commandPrefix(properties.getValidation().getJavaCommand()));
    }

    ChildProcessLauncher(List<String> commandPrefix) {
        this.commandPrefix = List.copyOf(commandPrefix);
    }

    static List<String> commandPrefix(String override) {
        if (override != null && !override.isBlank()) {
            return Arrays.asList(override.trim().split("\\s+"));
        }
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        String classPath = System.getProperty("java.class.path", "");
        if (classPath.endsWith(".jar") && !classPath.contains(File.pathSeparator)) {
            return List.of(java, "-jar", classPath);
        }
        return List.of(java, "-cp", classPath, MsstApplication.class.getName());
    }

    List<String> buildCommand(ChildTestRequest request) {
        var command = new ArrayList<>(commandPrefix);
        command.addAll(List.of(
                "run",
                "--config", request.configFile().toString(),
                "--test", request.testId(),
                "--output-dir", request.workDir().toString(),
                "--output-format", "json",
                "--result-file", request.resultFile().toString()));
        return command;
    }

    @Override
    public String launch(ChildTestRequest request) throws IOException {
        Files.createDirectories(request.workDir());
        Path outputLog = request.workDir().resolve(OUTPUT_LOG);
        List<String> command = buildCommand(request);
        log.debug("Launching test {}: {}", request.testId(), String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(outputLog.toFile())
                .start();

        String handle = "test-" + request.testId() + "-" + process.pid();
        children.put(handle, new Child(process, outputLog));
        log.info("Started child {} for test {}", handle, request.testId());
        return handle;
    }

    @Override
    public OptionalInt waitForCompletion(String handle, Duration timeout) throws InterruptedException {
        Child child = require(handle);
        if (child.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return OptionalInt.of(child.process().exitValue());
        }
        log.warn("Child {} still running after {}s", handle, timeout.toSeconds());
        return OptionalInt.empty();
    }

    @Override
    public String captureOutput(String handle) {
        Child child = require(handle);
        try {
            return Files.exists(child.outputLog())
                    ? Files.readString(child.outputLog(), StandardCharsets.UTF_8)
                    : "";
        } catch (IOException e) {
            log.warn("Cannot read output of child {}: {}", handle, e.getMessage());
            return "";
        }
    }

    @Override
    public void teardown(String handle) {
        Child child = children.remove(handle);
        if (child == null) {
            return;
        }
        Process process = child.process();
        if (process.isAlive()) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            try {
                if (!process.waitFor(10, TimeUnit.SECONDS)) {
                    log.warn("Child {} did not exit after forced termination", handle);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while terminating child {}", handle);
            }
            log.info("Child {} terminated", handle);
        }
    }

    private Child require(String handle) {
        Child child = children.get(handle);
        if (child == null) {
            throw new IllegalArgumentException("Unknown child process handle: " + handle);
        }
        return child;
    }
}
