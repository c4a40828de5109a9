package com.vidrecorder.config;

import com.vidrecorder.storage.LocalBlobStoreService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Filesystem blob backend, selected with {@code recording.storage.backend=local}.
 */
@Configuration
@ConditionalOnProperty(name = "recording.storage.backend", havingValue = "local")
public class LocalStorageConfig {

    @Bean
    public LocalBlobStoreService blobStoreService(
            @Value("${recording.storage.local.root-dir:./blob-store}") String rootDir,
            @Value("${recording.storage.local.public-base-url:http://localhost:8080}") String publicBaseUrl,
            @Value("${recording.storage.local.signing-key}") String signingKey,
            Clock clock) {
        LocalBlobStoreService store = new LocalBlobStoreService(Path.of(rootDir), publicBaseUrl, signingKey, clock);
        store.initialize();
        return store;
    }
}
