package com.msst.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.msst.core.model.SuiteResult;
import com.msst.core.model.TestResult;
import com.msst.core.model.ValidationReport;
import com.msst.core.report.ReportWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Persists a {@link ValidationReport} as {@code validation-report.json} (complete
 * structured record) and {@code validation-report.txt} (narrative).
 */
@Service
public class ValidationReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ValidationReportWriter.class);

    public static final String JSON_REPORT = "validation-report.json";
    public static final String TEXT_REPORT = "validation-report.txt";

    private static final String RULE = "=".repeat(80);

    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @return the files written, structured record first
     * @throws ReportWriteException when either file cannot be written
     */
    public List<Path> write(ValidationReport report, Path outputDir) {
        Path json = outputDir.resolve(JSON_REPORT);
        Path text = outputDir.resolve(TEXT_REPORT);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(json, toJson(report), StandardCharsets.UTF_8);
            Files.writeString(text, toText(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportWriteException("Cannot write validation report to " + outputDir + ": " + e.getMessage(), e);
        }
        log.info("Validation report written to {} and {}", json, text);
        return List.of(json, text);
    }

    public String toJson(ValidationReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize validation report", e);
        }
    }

    public String toText(ValidationReport report) {
        var sb = new StringBuilder();
        sb.append("S3 PRODUCTION VALIDATION REPORT\n");
        sb.append(RULE).append("\n\n");
        sb.append("Timestamp: ").append(report.timestamp()).append('\n');
        sb.append("Endpoint: ").append(report.config().endpoint()).append('\n');
        sb.append("Vendor: ").append(report.config().vendor()).append("\n\n");

        sb.append("TEST RESULTS BY CATEGORY\n");
        sb.append("-".repeat(40)).append('\n');
        for (SuiteResult suite : report.suites().values()) {
            sb.append('\n').append(suite.name()).append(": ")
                    .append(suite.meetsRequirement() ? "✓ PASS" : "✗ FAIL").append('\n');
            sb.append(String.format(Locale.ROOT, "  Pass rate: %.1f%% (required: %s%%)%n",
                    suite.passRate(), SuiteEvaluationService.formatRate(suite.requiredPassRate())));
            sb.append("  Tests passed: ").append(suite.passed()).append('/').append(suite.total()).append('\n');
            for (TestResult test : suite.tests()) {
                if (!test.passed()) {
                    sb.append("    ").append(test.status().glyph()).append(" Test ").append(test.testId())
                            .append(" [").append(test.status()).append("]: ").append(test.message()).append('\n');
                }
            }
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append(String.format(Locale.ROOT, "Overall pass rate: %.1f%% (%d/%d)%n",
                report.summary().overallPassRate(), report.summary().passed(), report.summary().totalTests()));
        sb.append("PRODUCTION READINESS: ").append(report.productionReady() ? "✓ READY" : "✗ NOT READY").append('\n');
        return sb.toString();
    }
}
