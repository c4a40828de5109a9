package com.vidrecorder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Client-facing projection of a {@link RecordingJob}; scratch paths stay server-side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordingView {
    private String id;
    private String roomId;
    private String roomCode;
    private String roomName;
    private String ownerId;
    private String ownerName;
    private List<String> participantIds;
    private RecordingStatus status;
    private Instant startTime;
    private Instant endTime;
    private Long durationSeconds;
    private String storageUrl;
    private Long fileSizeBytes;
    private String errorDetail;
    private Instant retentionDeadline;

    public static RecordingView from(RecordingJob job) {
        return RecordingView.builder()
                .id(job.getId())
                .roomId(job.getRoomId())
                .roomCode(job.getRoomCode())
                .roomName(job.getRoomName())
                .ownerId(job.getOwnerId())
                .ownerName(job.getOwnerName())
                .participantIds(job.getParticipantIds() == null ? List.of() : job.getParticipantIds().stream().sorted().toList())
                .status(job.getStatus())
                .startTime(job.getStartTime())
                .endTime(job.getEndTime())
                .durationSeconds(job.getDurationSeconds())
                .storageUrl(job.getStorageUrl())
                .fileSizeBytes(job.getFileSizeBytes())
                .errorDetail(job.getErrorDetail())
                .retentionDeadline(job.getRetentionDeadline())
                .build();
    }
}
