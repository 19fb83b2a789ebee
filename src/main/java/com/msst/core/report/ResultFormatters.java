package com.msst.core.report;

/**
 * Formatter lookup by {@link OutputFormat}.
 */
public final class ResultFormatters {

    private ResultFormatters() {}

    public static ResultFormatter forFormat(OutputFormat format) {
        return switch (format) {
            case JSON -> new JsonResultFormatter();
            case YAML -> new YamlResultFormatter();
            case TEXT -> new TextResultFormatter();
            case JUNIT -> new JunitXmlResultFormatter();
        };
    }
}
