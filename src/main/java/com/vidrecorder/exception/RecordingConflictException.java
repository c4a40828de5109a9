package com.vidrecorder.exception;

import lombok.Getter;

/**
 * Thrown when a room already has an active, non-stale recording.
 */
@Getter
public class RecordingConflictException extends RecordingException {

    private final String roomId;
    private final String activeRecordingId;

    public RecordingConflictException(String roomId, String activeRecordingId) {
        super("A recording is already in progress for this room. Please stop the current recording first.");
        this.roomId = roomId;
        this.activeRecordingId = activeRecordingId;
    }
}
