package com.vidrecorder.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * One recording of a room, from start through durable offload to retention expiry.
 * <p>
 * {@code activeRoomId} mirrors {@code roomId} while the job is recording or processing and is null
 * otherwise. Its unique constraint is what keeps a room down to a single active job.
 */
@Entity
@Table(name = "recording_jobs", indexes = {
        @Index(name = "idx_recording_room", columnList = "roomId"),
        @Index(name = "idx_recording_owner", columnList = "ownerId"),
        @Index(name = "idx_recording_retention", columnList = "status, retentionDeadline")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordingJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String roomId;

    @Column(nullable = false)
    private String roomCode;

    @Column(nullable = false)
    private String roomName;

    @Column(nullable = false)
    private String ownerId;

    private String ownerName;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "recording_participants", joinColumns = @JoinColumn(name = "recording_id"))
    @Column(name = "participant_id", nullable = false)
    private Set<String> participantIds = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RecordingStatus status;

    @Column(nullable = false)
    private Instant startTime;

    private Instant endTime;

    private Long durationSeconds;

    @Column(length = 1024)
    private String storageLocator;

    @Column(length = 2048)
    private String storageUrl;

    private Long fileSizeBytes;

    @Column(length = 1024)
    private String scratchFilePath;

    @Column(length = 2048)
    private String errorDetail;

    private Instant retentionDeadline;

    @Column(unique = true)
    private String activeRoomId;

    @PrePersist
    @PreUpdate
    void syncActiveRoom() {
        this.activeRoomId = status != null && status.isActive() ? roomId : null;
    }

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public boolean isReadableBy(String userId) {
        return isOwnedBy(userId) || (participantIds != null && participantIds.contains(userId));
    }
}
