package com.vidrecorder.config;

import com.vidrecorder.storage.BlobStoreService;
import com.vidrecorder.storage.CloudflareR2Service;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "recording.storage.backend", havingValue = "r2", matchIfMissing = true)
public class R2Config {

    @Value("${cloudflare.r2.access-key}")
    private String accessKey;

    @Value("${cloudflare.r2.secret-key}")
    private String secretKey;

    @Value("${cloudflare.r2.endpoint}")
    private String endpoint;

    @Value("${cloudflare.r2.bucket}")
    private String bucket;

    @Value("${cloudflare.r2.api-call-timeout:2m}")
    private Duration apiCallTimeout;

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        // Configure S3 client to work with Cloudflare R2
        return S3Client.builder()
                .credentialsProvider(credentialsProvider())
                .endpointOverride(URI.create(endpoint))
                .region(Region.of("auto")) // R2 requires a region, but uses "auto"
                .serviceConfiguration(s3Configuration())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout)
                        .build())
                .build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        return S3Presigner.builder()
                .credentialsProvider(credentialsProvider())
                .endpointOverride(URI.create(endpoint))
                .region(Region.of("auto"))
                .serviceConfiguration(s3Configuration())
                .build();
    }

    @Bean
    public BlobStoreService blobStoreService(S3Client s3Client, S3Presigner s3Presigner) {
        return new CloudflareR2Service(s3Client, s3Presigner, bucket);
    }

    private StaticCredentialsProvider credentialsProvider() {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }

    private S3Configuration s3Configuration() {
        return S3Configuration.builder()
                .pathStyleAccessEnabled(true) // Required for R2
                .checksumValidationEnabled(false) // Improves compatibility
                .build();
    }
}
