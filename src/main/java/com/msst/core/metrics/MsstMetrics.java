package com.msst.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for test runs and validations.
 */
@Service
public class MsstMetrics {

    private final MeterRegistry registry;

    public MsstMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTest(String group, String status, double seconds) {
        Timer.builder("msst.test.duration")
                .tag("group", group)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofNanos((long) (seconds * 1_000_000_000L)));
    }

    public void recordSuiteEvaluation(String suite, boolean meetsRequirement) {
        Counter.builder("msst.suite.evaluations")
                .tag("suite", suite)
                .tag("result", meetsRequirement ? "meets" : "fails")
                .register(registry)
                .increment();
    }

    public void recordValidation(boolean productionReady) {
        Counter.builder("msst.validation.runs")
                .tag("ready", String.valueOf(productionReady))
                .register(registry)
                .increment();
    }
}
