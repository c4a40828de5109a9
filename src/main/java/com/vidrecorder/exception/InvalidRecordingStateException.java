package com.vidrecorder.exception;

import com.vidrecorder.model.RecordingStatus;
import lombok.Getter;

/**
 * A transition was requested from a state the state machine does not allow it from.
 */
@Getter
public class InvalidRecordingStateException extends RecordingException {

    private final RecordingStatus actual;

    public InvalidRecordingStateException(String recordingId, RecordingStatus actual, String action) {
        super("Cannot " + action + " recording " + recordingId + " in status " + actual.wireName());
        this.actual = actual;
    }
}
