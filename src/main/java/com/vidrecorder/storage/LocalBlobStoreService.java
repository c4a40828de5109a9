package com.vidrecorder.storage;

import com.vidrecorder.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Filesystem blob store for development and tests. Download URLs are HMAC-signed with an expiry and
 * served by {@link com.vidrecorder.controller.LocalBlobController}.
 */
@Slf4j
public class LocalBlobStoreService implements BlobStoreService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final Path rootDir;
    private final String publicBaseUrl;
    private final byte[] signingKey;
    private final Clock clock;

    public LocalBlobStoreService(Path rootDir, String publicBaseUrl, String signingKey, Clock clock) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.replaceAll("/+$", "");
        this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
        log.info("Initialized local blob store at: {}", this.rootDir);
    }

    @Override
    public String upload(Path localFile, String objectName) {
        Path target = resolve(objectName);
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.createDirectories(target.getParent());
            Files.copy(localFile, partial, StandardCopyOption.REPLACE_EXISTING);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(partial);
            throw new StorageFailureException("Failed to store " + objectName + " locally", e);
        }
        deleteQuietly(localFile);
        log.info("Stored recording locally: {}", objectName);
        return publicBaseUrl + "/api/blobs/" + encode(objectName);
    }

    @Override
    public String signedDownloadUrl(String objectName, Duration ttl) {
        if (!Files.exists(resolve(objectName))) {
            throw new StorageFailureException("Object does not exist: " + objectName);
        }
        long expires = clock.instant().plus(ttl).getEpochSecond();
        return publicBaseUrl + "/api/blobs/" + encode(objectName)
                + "?expires=" + expires + "&signature=" + sign(objectName, expires);
    }

    /**
     * Resolves a signed download request to the stored file, or empty when the signature is invalid,
     * expired, or the object is gone.
     */
    public Optional<Path> openSigned(String objectName, long expires, String signature) {
        if (signature == null || expires < clock.instant().getEpochSecond()) {
            return Optional.empty();
        }
        byte[] expected = sign(objectName, expires).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8))) {
            return Optional.empty();
        }
        Path file = resolve(objectName);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    @Override
    public boolean delete(String objectName) {
        try {
            return Files.deleteIfExists(resolve(objectName));
        } catch (IOException e) {
            throw new StorageFailureException("Failed to delete " + objectName + " locally", e);
        }
    }

    @Override
    public void initialize() {
        try {
            Files.createDirectories(rootDir);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to create local blob directory " + rootDir, e);
        }
    }

    @Override
    public boolean isConfigured() {
        return Files.isDirectory(rootDir) && Files.isWritable(rootDir);
    }

    @Override
    public String backendName() {
        return "local";
    }

    private Path resolve(String objectName) {
        Path resolved = rootDir.resolve(objectName).normalize();
        if (!resolved.startsWith(rootDir) || resolved.equals(rootDir)) {
            throw new IllegalArgumentException("Invalid object name: " + objectName);
        }
        return resolved;
    }

    private String sign(String objectName, long expires) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal((objectName + "\n" + expires).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static String encode(String objectName) {
        return URLEncoder.encode(objectName, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove {}", path, e);
        }
    }
}
