package com.vidrecorder.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Field-merge update for a {@link RecordingJob}. Null fields are left untouched; clearing the
 * scratch path is the one explicit removal a transition needs.
 */
@Value
@Builder
public class RecordingJobPatch {

    /** When set, the update only applies if the stored job is in this status. */
    RecordingStatus expectedStatus;

    RecordingStatus status;
    Instant endTime;
    Long durationSeconds;
    String storageLocator;
    String storageUrl;
    Long fileSizeBytes;
    String scratchFilePath;
    boolean clearScratchFilePath;
    String errorDetail;
    Instant retentionDeadline;
    Set<String> addParticipantIds;

    public void applyTo(RecordingJob job) {
        if (status != null) job.setStatus(status);
        if (endTime != null) job.setEndTime(endTime);
        if (durationSeconds != null) job.setDurationSeconds(durationSeconds);
        if (storageLocator != null) job.setStorageLocator(storageLocator);
        if (storageUrl != null) job.setStorageUrl(storageUrl);
        if (fileSizeBytes != null) job.setFileSizeBytes(fileSizeBytes);
        if (clearScratchFilePath) {
            job.setScratchFilePath(null);
        } else if (scratchFilePath != null) {
            job.setScratchFilePath(scratchFilePath);
        }
        if (errorDetail != null) job.setErrorDetail(errorDetail);
        if (retentionDeadline != null) job.setRetentionDeadline(retentionDeadline);
        if (addParticipantIds != null && !addParticipantIds.isEmpty()) {
            job.getParticipantIds().addAll(addParticipantIds);
        }
        job.syncActiveRoom();
    }
}
