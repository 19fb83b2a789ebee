package com.msst.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing msst-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSuite(String suite) {
        MDC.put("suite", suite);
    }

    public static void setTest(String testId) {
        MDC.put("testId", testId);
    }

    public static void clearTest() {
        MDC.remove("testId");
    }

    public static void clear() {
        MDC.remove("suite");
        MDC.remove("testId");
    }
}
