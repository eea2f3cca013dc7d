package com.digitalgroup.reportscheduler.integration.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.UUID;

/**
 * S3 Storage Service
 * Stores rendered reports in S3 and hands out pre-signed download links.
 * SDK exceptions propagate; callers decide whether a failure is worth retrying.
 */
@Slf4j
@Service
public class S3StorageService {

    /**
     * S3 rejects pre-signed URLs valid for longer than seven days
     */
    public static final Duration MAX_LINK_EXPIRY = Duration.ofDays(7);

    @Value("${aws.access-key-id:}")
    private String accessKeyId;

    @Value("${aws.secret-access-key:}")
    private String secretAccessKey;

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${aws.s3.bucket:}")
    private String bucketName;

    @Value("${aws.s3.enabled:false}")
    private boolean enabled;

    @Value("${aws.s3.shared-prefix:shared}")
    private String sharedPrefix;

    private S3Client s3Client;
    private S3Presigner presigner;

    @PostConstruct
    public void initialize() {
        if (!enabled || accessKeyId.isEmpty() || secretAccessKey.isEmpty() || bucketName.isEmpty()) {
            log.info("S3 Storage is disabled or not configured");
            return;
        }

        try {
            AwsBasicCredentials credentials = AwsBasicCredentials.create(accessKeyId, secretAccessKey);

            s3Client = S3Client.builder()
                    .region(Region.of(region))
                    .credentialsProvider(StaticCredentialsProvider.create(credentials))
                    .build();

            presigner = S3Presigner.builder()
                    .region(Region.of(region))
                    .credentialsProvider(StaticCredentialsProvider.create(credentials))
                    .build();

            log.info("S3 Storage initialized for bucket: {}", bucketName);

        } catch (Exception e) {
            log.error("Failed to initialize S3 client", e);
        }
    }

    @PreDestroy
    public void close() {
        if (s3Client != null) {
            s3Client.close();
        }
        if (presigner != null) {
            presigner.close();
        }
    }

    /**
     * Upload bytes under the given key
     * @return the ETag S3 assigned to the object
     */
    public String upload(byte[] data, String key, String contentType) {
        requireEnabled();

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();

        PutObjectResponse response = s3Client.putObject(request, RequestBody.fromBytes(data));
        log.info("Uploaded report to S3: {} ({} bytes)", key, data.length);
        return response.eTag();
    }

    /**
     * Pre-signed GET URL, expiry capped at {@link #MAX_LINK_EXPIRY}
     */
    public String getPresignedUrl(String key, Duration expiration) {
        requireEnabled();

        Duration effective = expiration.compareTo(MAX_LINK_EXPIRY) > 0 ? MAX_LINK_EXPIRY : expiration;

        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();

        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(effective)
                .getObjectRequest(getObjectRequest)
                .build();

        return presigner.presignGetObject(presignRequest).url().toString();
    }

    /**
     * Upload under the shared prefix and return a download link for it
     */
    public String createShareLink(byte[] data, String fileName, String contentType, Duration expiration) {
        String key = sharedPrefix + "/" + UUID.randomUUID() + "/" + fileName;
        upload(data, key, contentType);
        return getPresignedUrl(key, expiration);
    }

    public boolean isEnabled() {
        return enabled && s3Client != null;
    }

    public String getBucketName() {
        return bucketName;
    }

    private void requireEnabled() {
        if (!isEnabled()) {
            throw new IllegalStateException("S3 Storage is not enabled");
        }
    }
}
