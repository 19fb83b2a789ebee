package com.msst.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.BucketVersioningStatus;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteMarkerEntry;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListMultipartUploadsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListPartsRequest;
import software.amazon.awssdk.services.s3.model.MultipartUpload;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.ObjectVersion;
import software.amazon.awssdk.services.s3.model.Part;
import software.amazon.awssdk.services.s3.model.PutBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.VersioningConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Vendor-neutral pass-through to an S3 endpoint used by test units.
 * <p>
 * Every SDK fault is rethrown as a {@link StorageException} carrying the service's
 * error code, so units can assert on codes without depending on SDK exception types.
 */
public class S3StorageClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(S3StorageClient.class);

    private static final String DEFAULT_REGION = "us-east-1";

    private final S3Client s3;
    private final String region;
    private final String endpoint;

    public S3StorageClient(S3Client s3, String region, String endpoint) {
        this.s3 = s3;
        this.region = region;
        this.endpoint = endpoint;
    }

    /** The underlying SDK client, for operations this wrapper does not cover. */
    public S3Client sdk() {
        return s3;
    }

    public String endpoint() {
        return endpoint;
    }

    // -- Buckets ---------------------------------------------------------

    public void createBucket(String bucket) {
        call("create bucket " + bucket, () -> {
            var request = CreateBucketRequest.builder().bucket(bucket);
            if (region != null && !DEFAULT_REGION.equals(region)) {
                request.createBucketConfiguration(CreateBucketConfiguration.builder()
                        .locationConstraint(region)
                        .build());
            }
            return s3.createBucket(request.build());
        });
        log.debug("Created bucket: {}", bucket);
    }

    public void deleteBucket(String bucket) {
        call("delete bucket " + bucket, () -> s3.deleteBucket(DeleteBucketRequest.builder().bucket(bucket).build()));
        log.debug("Deleted bucket: {}", bucket);
    }

    public boolean bucketExists(String bucket) {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return true;
        } catch (NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw translate("head bucket " + bucket, e);
        } catch (SdkException e) {
            throw translate("head bucket " + bucket, e);
        }
    }

    public List<String> listBuckets() {
        return call("list buckets", () -> s3.listBuckets().buckets().stream().map(Bucket::name).toList());
    }

    public void setVersioning(String bucket, boolean enabled) {
        call("put bucket versioning " + bucket, () -> s3.putBucketVersioning(PutBucketVersioningRequest.builder()
                .bucket(bucket)
                .versioningConfiguration(VersioningConfiguration.builder()
                        .status(enabled ? BucketVersioningStatus.ENABLED : BucketVersioningStatus.SUSPENDED)
                        .build())
                .build()));
    }

    /** @return "Enabled", "Suspended", or empty when versioning was never configured */
    public String versioningStatus(String bucket) {
        return call("get bucket versioning " + bucket, () -> {
            String status = s3.getBucketVersioning(GetBucketVersioningRequest.builder().bucket(bucket).build())
                    .statusAsString();
            return status != null ? status : "";
        });
    }

    /**
     * Deletes every object, version and delete marker in the bucket.
     */
    public void emptyBucket(String bucket) {
        for (String key : listObjects(bucket, null)) {
            deleteObject(bucket, key);
        }
        ListObjectVersionsResponse versions;
        try {
            versions = s3.listObjectVersions(ListObjectVersionsRequest.builder().bucket(bucket).build());
        } catch (S3Exception e) {
            // endpoints without versioning support reject the listing; plain objects are already gone
            log.debug("Version listing unavailable for {}: {}", bucket, e.getMessage());
            return;
        } catch (SdkException e) {
            throw translate("list object versions " + bucket, e);
        }
        for (ObjectVersion v : versions.versions()) {
            deleteObjectVersion(bucket, v.key(), v.versionId());
        }
        for (DeleteMarkerEntry m : versions.deleteMarkers()) {
            deleteObjectVersion(bucket, m.key(), m.versionId());
        }
    }

    // -- Objects ---------------------------------------------------------

    /** @return the ETag reported by the service */
    public String putObject(String bucket, String key, byte[] body) {
        String etag = call("put object " + bucket + "/" + key, () -> s3.putObject(
                PutObjectRequest.builder().bucket(bucket).key(key).build(),
                RequestBody.fromBytes(body)).eTag());
        log.debug("Put object: {}/{} ({} bytes)", bucket, key, body.length);
        return etag;
    }

    /** Upload with user metadata; the response carries the ETag and, on versioned buckets, the version ID. */
    public PutObjectResponse putObject(String bucket, String key, byte[] body, Map<String, String> metadata) {
        PutObjectResponse response = call("put object " + bucket + "/" + key, () -> s3.putObject(
                PutObjectRequest.builder().bucket(bucket).key(key).metadata(metadata).build(),
                RequestBody.fromBytes(body)));
        log.debug("Put object: {}/{} ({} bytes, {} metadata entries)", bucket, key, body.length, metadata.size());
        return response;
    }

    public byte[] getObject(String bucket, String key) {
        return call("get object " + bucket + "/" + key, () -> s3.getObjectAsBytes(
                GetObjectRequest.builder().bucket(bucket).key(key).build()).asByteArray());
    }

    public byte[] getObjectVersion(String bucket, String key, String versionId) {
        return call("get object " + bucket + "/" + key + "@" + versionId, () -> s3.getObjectAsBytes(
                GetObjectRequest.builder().bucket(bucket).key(key).versionId(versionId).build()).asByteArray());
    }

    public HeadObjectResponse headObject(String bucket, String key) {
        return call("head object " + bucket + "/" + key,
                () -> s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build()));
    }

    public void deleteObject(String bucket, String key) {
        call("delete object " + bucket + "/" + key,
                () -> s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build()));
        log.debug("Deleted object: {}/{}", bucket, key);
    }

    public void deleteObjectVersion(String bucket, String key, String versionId) {
        call("delete object version " + bucket + "/" + key, () -> s3.deleteObject(
                DeleteObjectRequest.builder().bucket(bucket).key(key).versionId(versionId).build()));
    }

    /** Keys in the bucket, optionally restricted to a prefix. */
    public List<String> listObjects(String bucket, String prefix) {
        return call("list objects " + bucket, () -> {
            var request = ListObjectsV2Request.builder().bucket(bucket);
            if (prefix != null) {
                request.prefix(prefix);
            }
            var keys = new ArrayList<String>();
            s3.listObjectsV2Paginator(request.build()).contents().stream()
                    .map(S3Object::key)
                    .forEach(keys::add);
            return keys;
        });
    }

    public List<ObjectVersion> listObjectVersions(String bucket, String prefix) {
        return call("list object versions " + bucket, () -> s3.listObjectVersions(
                ListObjectVersionsRequest.builder().bucket(bucket).prefix(prefix).build()).versions());
    }

    // -- Multipart -------------------------------------------------------

    /** @return the upload ID */
    public String createMultipartUpload(String bucket, String key) {
        return call("create multipart upload " + bucket + "/" + key, () -> s3.createMultipartUpload(
                CreateMultipartUploadRequest.builder().bucket(bucket).key(key).build()).uploadId());
    }

    public CompletedPart uploadPart(String bucket, String key, String uploadId, int partNumber, byte[] body) {
        String etag = call("upload part " + partNumber + " of " + bucket + "/" + key, () -> s3.uploadPart(
                UploadPartRequest.builder()
                        .bucket(bucket).key(key).uploadId(uploadId).partNumber(partNumber)
                        .build(),
                RequestBody.fromBytes(body)).eTag());
        return CompletedPart.builder().partNumber(partNumber).eTag(etag).build();
    }

    /** @return the ETag of the assembled object */
    public String completeMultipartUpload(String bucket, String key, String uploadId, List<CompletedPart> parts) {
        return call("complete multipart upload " + bucket + "/" + key, () -> s3.completeMultipartUpload(
                CompleteMultipartUploadRequest.builder()
                        .bucket(bucket).key(key).uploadId(uploadId)
                        .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                        .build()).eTag());
    }

    public void abortMultipartUpload(String bucket, String key, String uploadId) {
        call("abort multipart upload " + bucket + "/" + key, () -> s3.abortMultipartUpload(
                AbortMultipartUploadRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build()));
    }

    public List<Part> listParts(String bucket, String key, String uploadId) {
        return call("list parts " + bucket + "/" + key, () -> s3.listParts(
                ListPartsRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build()).parts());
    }

    public List<MultipartUpload> listMultipartUploads(String bucket) {
        return call("list multipart uploads " + bucket, () -> s3.listMultipartUploads(
                ListMultipartUploadsRequest.builder().bucket(bucket).build()).uploads());
    }

    @Override
    public void close() {
        s3.close();
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (SdkException e) {
            log.error("Error during {}: {}", operation, e.getMessage());
            throw translate(operation, e);
        }
    }

    static StorageException translate(String operation, SdkException e) {
        if (e instanceof S3Exception s3e) {
            String code = s3e.awsErrorDetails() != null && s3e.awsErrorDetails().errorCode() != null
                    ? s3e.awsErrorDetails().errorCode()
                    : String.valueOf(s3e.statusCode());
            return new StorageException("Failed to " + operation + ": " + code, code, s3e.statusCode(), e);
        }
        return new StorageException("Failed to " + operation + ": " + e.getMessage(), "ClientError", 0, e);
    }
}
