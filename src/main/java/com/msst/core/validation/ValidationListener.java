package com.msst.core.validation;

import com.msst.core.model.Suite;
import com.msst.core.model.SuiteResult;
import com.msst.core.model.SuiteState;
import com.msst.core.model.TestResult;
import com.msst.core.model.ValidationReport;

/**
 * Progress callbacks of a validation run. All methods default to no-ops.
 */
public interface ValidationListener {

    ValidationListener NONE = new ValidationListener() {};

    default void suiteStarted(Suite suite) {}

    default void suiteStateChanged(Suite suite, SuiteState state) {}

    default void testStarted(Suite suite, String testId) {}

    default void testCompleted(Suite suite, TestResult result) {}

    default void suiteCompleted(SuiteResult result) {}

    default void validationCompleted(ValidationReport report) {}
}
