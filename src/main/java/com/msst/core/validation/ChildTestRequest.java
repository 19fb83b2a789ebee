package com.msst.core.validation;

import java.nio.file.Path;

/**
 * Everything a child process needs to run one test.
 *
 * @param testId     normalized test ID
 * @param configFile endpoint configuration passed through to the child
 * @param workDir    per-test directory for the child's results and captured output
 * @param resultFile where the child writes its structured result
 */
public record ChildTestRequest(
    String testId,
    Path configFile,
    Path workDir,
    Path resultFile
) {}
