package com.vidrecorder.exception;

public class RecordingNotFoundException extends RecordingException {

    public RecordingNotFoundException(String message) {
        super(message);
    }

    public static RecordingNotFoundException forId(String recordingId) {
        return new RecordingNotFoundException("Recording not found: " + recordingId);
    }
}
