package com.vidrecorder.storage;

import com.vidrecorder.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Blob store backed by Cloudflare R2 through the S3 API.
 */
@Slf4j
public class CloudflareR2Service implements BlobStoreService {

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucketName;

    public CloudflareR2Service(S3Client s3Client, S3Presigner presigner, String bucketName) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucketName = bucketName;
        log.info("Initialized Cloudflare R2 blob store for bucket: {}", bucketName);
    }

    /**
     * Upload a recording to Cloudflare R2
     */
    @Override
    public String upload(Path localFile, String objectName) {
        log.info("Uploading recording to R2: {} -> {}", localFile, objectName);

        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(objectName)
                .contentType(ContentTypes.forFileName(objectName))
                .build();

        try {
            s3Client.putObject(putObjectRequest, RequestBody.fromFile(localFile));
        } catch (SdkException e) {
            log.error("R2 upload failed for {}, keeping local file {}", objectName, localFile, e);
            throw new StorageFailureException("Failed to upload " + objectName + " to R2", e);
        }

        String url = s3Client.utilities()
                .getUrl(GetUrlRequest.builder().bucket(bucketName).key(objectName).build())
                .toString();
        log.info("Recording uploaded successfully: {}", objectName);

        try {
            Files.deleteIfExists(localFile);
        } catch (IOException e) {
            log.warn("Uploaded {} but could not remove local file {}", objectName, localFile, e);
        }
        return url;
    }

    @Override
    public String signedDownloadUrl(String objectName, Duration ttl) {
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(GetObjectRequest.builder().bucket(bucketName).key(objectName).build())
                .build();
        try {
            return presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkException e) {
            throw new StorageFailureException("Failed to sign download URL for " + objectName, e);
        }
    }

    @Override
    public boolean delete(String objectName) {
        log.info("Deleting recording from R2: {}", objectName);
        try {
            // S3 DeleteObject succeeds for missing keys
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(objectName).build());
            return true;
        } catch (SdkException e) {
            throw new StorageFailureException("Failed to delete " + objectName + " from R2", e);
        }
    }

    @Override
    public void initialize() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            log.info("R2 bucket already exists: {}", bucketName);
        } catch (NoSuchBucketException e) {
            createBucket();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                createBucket();
            } else {
                throw new StorageFailureException("Failed to check R2 bucket " + bucketName, e);
            }
        } catch (SdkException e) {
            throw new StorageFailureException("Failed to check R2 bucket " + bucketName, e);
        }
    }

    private void createBucket() {
        try {
            s3Client.createBucket(CreateBucketRequest.builder().bucket(bucketName).build());
            log.info("Created R2 bucket: {}", bucketName);
        } catch (SdkException e) {
            throw new StorageFailureException("Failed to create R2 bucket " + bucketName, e);
        }
    }

    @Override
    public boolean isConfigured() {
        return bucketName != null && !bucketName.isBlank();
    }

    @Override
    public String backendName() {
        return "r2";
    }
}
