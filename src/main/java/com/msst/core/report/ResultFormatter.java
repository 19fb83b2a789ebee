package com.msst.core.report;

import com.msst.core.model.TestRun;

/**
 * Renders a frozen {@link TestRun} as text. Implementations are pure: no I/O, no
 * shared mutable state, and identical input always yields identical output.
 */
public interface ResultFormatter {

    OutputFormat outputFormat();

    String format(TestRun run);
}
