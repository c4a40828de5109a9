package com.vidrecorder.exception;

/**
 * Base type for failures raised by the recording lifecycle, upload assembly and blob storage layers.
 */
public abstract class RecordingException extends RuntimeException {

    protected RecordingException(String message) {
        super(message);
    }

    protected RecordingException(String message, Throwable cause) {
        super(message, cause);
    }
}
