package com.vidrecorder.storage;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Long-term object storage for finished recordings.
 * <p>
 * Implementations throw {@link com.vidrecorder.exception.StorageFailureException} when the backend
 * cannot complete an operation.
 */
public interface BlobStoreService {

    /**
     * Uploads {@code localFile} as {@code objectName} and returns the object's URL. The local file is
     * removed only after the backend acknowledges the write; on failure it is left in place.
     */
    String upload(Path localFile, String objectName);

    /**
     * Issues a time-limited download URL for an existing object.
     */
    String signedDownloadUrl(String objectName, Duration ttl);

    /**
     * Deletes the object. Deleting an object that does not exist is not an error.
     *
     * @return false when the backend reports the object was already absent
     */
    boolean delete(String objectName);

    /**
     * Creates the bucket or root container if it does not exist yet.
     */
    void initialize();

    boolean isConfigured();

    String backendName();
}
