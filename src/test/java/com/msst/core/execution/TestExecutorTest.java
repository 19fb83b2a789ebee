package com.msst.core.execution;

import com.msst.core.config.EndpointConfig;
import com.msst.core.metrics.MsstMetrics;
import com.msst.core.model.TestResult;
import com.msst.core.model.TestStatus;
import com.msst.core.model.TestUnit;
import com.msst.storage.S3StorageClient;
import com.msst.storage.StorageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link TestExecutor}.
 * <p>
 * Units are nested classes below; the storage client is a Mockito mock.
 */
class TestExecutorTest {

    public static class Passing {
        public void test001(S3StorageClient client, EndpointConfig config) {
        }
    }

    public static class SizeMismatch {
        public void test005(S3StorageClient client, EndpointConfig config) {
            throw new AssertionError("Size mismatch: expected 10, got 5");
        }
    }

    public static class StorageFault {
        public void test012(S3StorageClient client, EndpointConfig config) {
            throw new StorageException("Failed to get object b/k: InternalError", "InternalError", 500, null);
        }
    }

    public static class Declines {
        public void test200(S3StorageClient client, EndpointConfig config) {
            throw new TestSkippedException("Versioning not supported by endpoint");
        }
    }

    public static class FallbackEntry {
        public static int calls;

        public void run(S3StorageClient client, EndpointConfig config) {
            calls++;
        }
    }

    public static class StaticEntry {
        public static void test007(S3StorageClient client, EndpointConfig config) {
        }
    }

    public static class ReturnsOutcome {
        public TestOutcome test008(S3StorageClient client, EndpointConfig config) {
            return TestOutcome.assertionFailed("Listed 2 of 3 objects");
        }
    }

    public static class ReturnsSkip {
        public TestOutcome test009(S3StorageClient client, EndpointConfig config) {
            return TestOutcome.skipped("ACLs disabled");
        }
    }

    public static class NoEntry {
        public void helper() {
        }
    }

    public static class UsesClient {
        public void test010(S3StorageClient client, EndpointConfig config) {
            client.createBucket(config.bucketPrefix() + "-010");
        }
    }

    private S3StorageClient client;
    private SimpleMeterRegistry registry;
    private TestExecutor executor;

    @BeforeEach
    void setUp() {
        client = mock(S3StorageClient.class);
        registry = new SimpleMeterRegistry();
        executor = new TestExecutor(client, EndpointConfig.defaults(), new MsstMetrics(registry));
    }

    private static TestUnit unit(String id, String group, Class<?> type) {
        return new TestUnit(id, "test_" + id, group, "", type);
    }

    @Nested
    @DisplayName("classification")
    class ClassificationTests {

        @Test
        @DisplayName("normal return is PASSED with the standard message")
        void passed() {
            TestResult result = executor.execute(unit("001", "basic", Passing.class));

            assertEquals(TestStatus.PASSED, result.status());
            assertEquals("Test passed successfully", result.message());
            assertEquals("", result.error());
            assertEquals("001", result.testId());
            assertEquals("test_001", result.testName());
            assertEquals("basic", result.testGroup());
            assertTrue(result.duration() >= 0);
            assertFalse(result.timestamp().isEmpty());
        }

        @Test
        @DisplayName("assertion failure is FAILED with the assertion text as message")
        void assertionFailure() {
            TestResult result = executor.execute(unit("005", "basic", SizeMismatch.class));

            assertEquals(TestStatus.FAILED, result.status());
            assertEquals("Size mismatch: expected 10, got 5", result.message());
            assertTrue(result.error().contains("AssertionError"));
        }

        @Test
        @DisplayName("collaborator fault is ERROR, not FAILED")
        void collaboratorFault() {
            TestResult result = executor.execute(unit("012", "basic", StorageFault.class));

            assertEquals(TestStatus.ERROR, result.status());
            assertTrue(result.message().startsWith("Test error: "));
            assertTrue(result.message().contains("InternalError"));
            assertTrue(result.error().contains("StorageException"));
        }

        @Test
        @DisplayName("declining unit is SKIPPED with its reason")
        void skipped() {
            TestResult result = executor.execute(unit("200", "versioning", Declines.class));

            assertEquals(TestStatus.SKIPPED, result.status());
            assertEquals("Versioning not supported by endpoint", result.message());
            assertEquals("", result.error());
        }

        @Test
        @DisplayName("returned outcome values are classified like thrown ones")
        void returnedOutcomes() {
            TestResult failed = executor.execute(unit("008", "basic", ReturnsOutcome.class));
            assertEquals(TestStatus.FAILED, failed.status());
            assertEquals("Listed 2 of 3 objects", failed.message());

            TestResult skipped = executor.execute(unit("009", "basic", ReturnsSkip.class));
            assertEquals(TestStatus.SKIPPED, skipped.status());
            assertEquals("ACLs disabled", skipped.message());
        }
    }

    @Nested
    @DisplayName("entry points")
    class EntryPointTests {

        @Test
        @DisplayName("falls back to run when test<id> is absent")
        void fallbackToRun() {
            FallbackEntry.calls = 0;
            TestResult result = executor.execute(unit("150", "multipart", FallbackEntry.class));

            assertEquals(TestStatus.PASSED, result.status());
            assertEquals(1, FallbackEntry.calls);
        }

        @Test
        @DisplayName("static entry points are invoked without an instance")
        void staticEntry() {
            assertEquals(TestStatus.PASSED, executor.execute(unit("007", "basic", StaticEntry.class)).status());
        }

        @Test
        @DisplayName("missing entry point is ERROR naming the expected method")
        void missingEntry() {
            TestResult result = executor.execute(unit("042", "basic", NoEntry.class));

            assertEquals(TestStatus.ERROR, result.status());
            assertTrue(result.message().contains("No test method 'test042' or 'run'"));
        }

        @Test
        @DisplayName("unit receives the client and configuration")
        void passesCollaborators() {
            executor.execute(unit("010", "basic", UsesClient.class));
            verify(client).createBucket("msst-test-010");
        }
    }

    @Test
    @DisplayName("records a duration timer tagged with group and status")
    void recordsMetrics() {
        executor.execute(unit("001", "basic", Passing.class));
        executor.execute(unit("005", "basic", SizeMismatch.class));

        var passed = registry.find("msst.test.duration").tag("group", "basic").tag("status", "PASSED").timer();
        var failed = registry.find("msst.test.duration").tag("group", "basic").tag("status", "FAILED").timer();
        assertNotNull(passed);
        assertNotNull(failed);
        assertEquals(1, passed.count());
        assertEquals(1, failed.count());
    }

    @Test
    @DisplayName("closing the executor closes the storage client")
    void closeClosesClient() {
        executor.close();
        verify(client).close();
    }
}
