package com.msst.core.model;

import java.util.List;

/**
 * A named, configured group of test IDs used for go/no-go decisions.
 *
 * @param key              configuration key (e.g. "critical")
 * @param name             display name
 * @param testIds          test IDs in execution order
 * @param requiredPassRate minimum pass rate, 0-100
 * @param description      what the suite covers
 */
public record Suite(
    String key,
    String name,
    List<String> testIds,
    double requiredPassRate,
    String description
) {
    public Suite {
        testIds = List.copyOf(testIds);
        if (requiredPassRate < 0 || requiredPassRate > 100) {
            throw new IllegalArgumentException(
                    "Suite " + key + ": required pass rate must be within 0-100, got " + requiredPassRate);
        }
    }
}
