package com.msst.core.report;

import java.util.Arrays;
import java.util.Locale;

/**
 * Result file formats supported by the test runner.
 */
public enum OutputFormat {
    JSON("json", ".json"),
    YAML("yaml", ".yaml"),
    TEXT("text", ".txt"),
    JUNIT("junit", ".xml");

    private final String value;
    private final String extension;

    OutputFormat(String value, String extension) {
        this.value = value;
        this.extension = extension;
    }

    public String value() {
        return value;
    }

    public String extension() {
        return extension;
    }

    public static OutputFormat fromValue(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.value.equals(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown output format: " + value + ". Valid formats: json, yaml, text, junit"));
    }
}
