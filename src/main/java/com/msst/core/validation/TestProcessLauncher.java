package com.msst.core.validation;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalInt;

/**
 * Abstraction for running a test in an isolated child process.
 * The process boundary is the unit of fault and hang isolation.
 * Implementation: ChildProcessLauncher (local JVM).
 */
public interface TestProcessLauncher {

    /**
     * Starts the child.
     * @return a handle identifying the child in later calls
     * @throws IOException when the process cannot be spawned
     */
    String launch(ChildTestRequest request) throws IOException;

    /**
     * Blocks until the child exits or the timeout elapses.
     * @return the exit code, or empty when the timeout elapsed first
     */
    OptionalInt waitForCompletion(String handle, Duration timeout) throws InterruptedException;

    /**
     * Captured stdout/stderr of the child.
     */
    String captureOutput(String handle);

    /**
     * Forcibly terminates the child if still alive and releases the handle.
     */
    void teardown(String handle);
}
