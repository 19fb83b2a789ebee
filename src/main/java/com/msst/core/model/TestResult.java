package com.msst.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Outcome of one execution attempt of a {@link TestUnit}.
 *
 * @param testId    normalized three-digit identifier
 * @param testName  display name
 * @param testGroup category of the unit
 * @param status    terminal status
 * @param duration  wall-clock seconds, never negative
 * @param message   short human-readable outcome
 * @param error     full diagnostic trace; empty unless FAILED or ERROR
 * @param timestamp execution start, ISO-8601
 */
public record TestResult(
    @JsonProperty("test_id") String testId,
    @JsonProperty("test_name") String testName,
    @JsonProperty("test_group") String testGroup,
    @JsonProperty("status") TestStatus status,
    @JsonProperty("duration") double duration,
    @JsonProperty("message") String message,
    @JsonProperty("error") String error,
    @JsonProperty("timestamp") String timestamp
) implements Serializable {

    public TestResult {
        if (duration < 0) {
            duration = 0;
        }
        message = message != null ? message : "";
        error = error != null ? error : "";
    }

    public boolean passed() {
        return status == TestStatus.PASSED;
    }
}
