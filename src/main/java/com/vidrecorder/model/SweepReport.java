package com.vidrecorder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SweepReport {
    private Instant startedAt;
    private int expired;
    private int deleted;
    private int failed;
    private int blobDeleteFailures;
    private int reapedUploadSessions;
    private boolean skipped; // another run was already in progress

    public static SweepReport skipped(Instant startedAt) {
        return new SweepReport(startedAt, 0, 0, 0, 0, 0, true);
    }
}
