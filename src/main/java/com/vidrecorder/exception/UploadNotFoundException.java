package com.vidrecorder.exception;

public class UploadNotFoundException extends RecordingException {

    public UploadNotFoundException(String uploadId) {
        super("Upload session not found: " + uploadId);
    }
}
