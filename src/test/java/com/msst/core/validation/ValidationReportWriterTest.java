package com.msst.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.msst.core.model.EndpointInfo;
import com.msst.core.model.Suite;
import com.msst.core.model.SuiteResult;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestStatus;
import com.msst.core.model.ValidationReport;
import com.msst.core.model.ValidationSummary;
import com.msst.core.report.ReportWriteException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ValidationReportWriterTest {

    @TempDir
    Path tempDir;

    private final ValidationReportWriter writer = new ValidationReportWriter();
    private final SuiteEvaluationService evaluation = new SuiteEvaluationService(null);

    private ValidationReport report() {
        SuiteResult critical = evaluation.evaluate(
                new Suite("critical", "Critical Data Integrity", List.of("004", "005"), 100, "Data integrity"),
                List.of(new TestResult("004", "test_004", "basic", TestStatus.PASSED, 0.4, "ok", "", "t"),
                        new TestResult("005", "test_005", "basic", TestStatus.FAILED, 2.1,
                                "Size mismatch: expected 10, got 5", "AssertionError", "t")));
        var suites = new LinkedHashMap<String, SuiteResult>();
        suites.put("critical", critical);
        ValidationSummary summary = evaluation.summarize(suites, "critical");
        return new ValidationReport("2025-03-01T10:15:30", new EndpointInfo("http://minio:9000", "minio"),
                suites, summary, evaluation.isProductionReady(suites, summary));
    }

    @Test
    @DisplayName("JSON record uses snake_case keys and carries every test")
    void jsonKeys() throws Exception {
        JsonNode root = new ObjectMapper().readTree(writer.toJson(report()));

        assertEquals("2025-03-01T10:15:30", root.get("timestamp").asText());
        assertEquals("http://minio:9000", root.get("config").get("endpoint").asText());
        assertFalse(root.get("production_ready").asBoolean());
        assertFalse(root.get("summary").get("critical_tests_passed").asBoolean());
        assertEquals(50.0, root.get("summary").get("overall_pass_rate").asDouble(), 1e-9);

        JsonNode critical = root.get("suites").get("critical");
        assertEquals(100.0, critical.get("required_pass_rate").asDouble(), 1e-9);
        assertEquals(2, critical.get("total").asInt());
        assertEquals(1, critical.get("passed").asInt());
        assertFalse(critical.get("meets_requirement").asBoolean());
        assertEquals("FAILS_REQUIREMENT", critical.get("state").asText());
        assertEquals("005", critical.get("tests").get(1).get("test_id").asText());
        assertEquals("FAILED", critical.get("tests").get(1).get("status").asText());
    }

    @Test
    @DisplayName("narrative lists suites, non-passing tests and the verdict")
    void narrative() {
        String text = writer.toText(report());

        assertTrue(text.startsWith("S3 PRODUCTION VALIDATION REPORT\n"));
        assertTrue(text.contains("Endpoint: http://minio:9000"));
        assertTrue(text.contains("Vendor: minio"));
        assertTrue(text.contains("Critical Data Integrity: ✗ FAIL"));
        assertTrue(text.contains("Pass rate: 50.0% (required: 100%)"));
        assertTrue(text.contains("Tests passed: 1/2"));
        assertTrue(text.contains("✗ Test 005 [FAILED]: Size mismatch: expected 10, got 5"));
        assertFalse(text.contains("Test 004 ["));
        assertTrue(text.contains("PRODUCTION READINESS: ✗ NOT READY"));
    }

    @Test
    @DisplayName("narrative rates use a dot regardless of the default locale")
    void localeIndependent() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            String text = writer.toText(report());

            assertTrue(text.contains("Pass rate: 50.0% (required: 100%)"));
            assertTrue(text.contains("Overall pass rate: 50.0% (1/2)"));
            assertFalse(text.contains("50,0"));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("write creates the directory and both files")
    void writesBoth() throws Exception {
        Path out = tempDir.resolve("validation-20250301-101530");

        List<Path> files = writer.write(report(), out);

        assertEquals(List.of(out.resolve(ValidationReportWriter.JSON_REPORT),
                out.resolve(ValidationReportWriter.TEXT_REPORT)), files);
        assertTrue(Files.readString(files.get(1)).contains("NOT READY"));
    }

    @Test
    @DisplayName("an unwritable directory raises ReportWriteException")
    void unwritable() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file");

        assertThrows(ReportWriteException.class, () -> writer.write(report(), blocker));
    }
}
