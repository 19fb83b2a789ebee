package com.msst.tests.multipart;

import com.msst.core.config.EndpointConfig;
import com.msst.core.discovery.CompatibilityTest;
import com.msst.storage.S3StorageClient;
import com.msst.tests.common.Checks;
import com.msst.tests.common.TestFixture;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Aborted uploads leave no object behind, reject further parts and do not affect
 * an object stored under the same key.
 */
@CompatibilityTest(id = "102", name = "Abort multipart upload")
public class AbortMultipartUpload {

    private static final int PART_SIZE = 5 * 1024 * 1024;

    public void test102(S3StorageClient client, EndpointConfig config) {
        try (var fixture = new TestFixture(client, config)) {
            String bucket = fixture.createBucket("test-102");
            String key = "abort-test.bin";

            String uploadId = fixture.startUpload(bucket, key);
            for (int part = 1; part <= 2; part++) {
                client.uploadPart(bucket, key, uploadId, part, fixture.randomBytes(PART_SIZE));
            }
            client.abortMultipartUpload(bucket, key, uploadId);
            fixture.uploadFinished(uploadId);

            Checks.expectError(() -> client.getObject(bucket, key), "Object after abort", "NoSuchKey", "404");
            Checks.expectError(() -> client.uploadPart(bucket, key, uploadId, 3,
                            "test data".getBytes(StandardCharsets.UTF_8)),
                    "Upload part with aborted ID", "NoSuchUpload", "InvalidUploadId");

            List<String[]> pending = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                String multiKey = "multi-abort-" + i + ".bin";
                pending.add(new String[] {multiKey, client.createMultipartUpload(bucket, multiKey)});
            }
            for (String[] upload : pending) {
                client.abortMultipartUpload(bucket, upload[0], upload[1]);
            }
            for (String[] upload : pending) {
                Checks.expectError(() -> client.getObject(bucket, upload[0]),
                        "Object " + upload[0] + " after abort", "NoSuchKey", "404");
            }

            String existingKey = "existing-object.bin";
            byte[] existing = fixture.randomBytes(1024);
            client.putObject(bucket, existingKey, existing);
            String overwriteId = fixture.startUpload(bucket, existingKey);
            client.uploadPart(bucket, existingKey, overwriteId, 1, fixture.randomBytes(PART_SIZE));
            client.abortMultipartUpload(bucket, existingKey, overwriteId);
            fixture.uploadFinished(overwriteId);

            Long size = client.headObject(bucket, existingKey).contentLength();
            Checks.check(size != null && size == existing.length,
                    "Size mismatch: expected " + existing.length + ", got " + size);
            Checks.check(client.listMultipartUploads(bucket).isEmpty(), "Aborted uploads are still listed");
        }
    }
}
