package com.vidrecorder.exception;

/**
 * Blob store or scratch disk operation failed. Upload failures leave the local file in place, so the
 * operation can be retried.
 */
public class StorageFailureException extends RecordingException {

    public StorageFailureException(String message) {
        super(message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
