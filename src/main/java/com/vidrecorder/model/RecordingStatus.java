package com.vidrecorder.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum RecordingStatus {
    RECORDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static final Set<RecordingStatus> ACTIVE = EnumSet.of(RECORDING, PROCESSING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
