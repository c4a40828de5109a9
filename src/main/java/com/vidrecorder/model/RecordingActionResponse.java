package com.vidrecorder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of a lifecycle action (start, stop, upload, cleanup, delete).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordingActionResponse {
    private String recordingId;
    private String status;
    private Instant startTime;
    private Long fileSizeBytes;
    private String message;

    public static RecordingActionResponse of(RecordingJob job, String message) {
        return RecordingActionResponse.builder()
                .recordingId(job.getId())
                .status(job.getStatus().wireName())
                .message(message)
                .build();
    }
}
