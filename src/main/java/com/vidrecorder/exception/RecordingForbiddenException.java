package com.vidrecorder.exception;

public class RecordingForbiddenException extends RecordingException {

    public RecordingForbiddenException(String message) {
        super(message);
    }
}
