package com.vidrecorder.service;

import com.vidrecorder.config.RecordingPolicyConfig;
import com.vidrecorder.exception.InvalidRecordingStateException;
import com.vidrecorder.exception.RecordingConflictException;
import com.vidrecorder.exception.RecordingForbiddenException;
import com.vidrecorder.exception.RecordingNotFoundException;
import com.vidrecorder.exception.StorageFailureException;
import com.vidrecorder.model.ChunkReceipt;
import com.vidrecorder.model.DownloadUrlResponse;
import com.vidrecorder.model.RecordingJob;
import com.vidrecorder.model.RecordingJobPatch;
import com.vidrecorder.model.RecordingStatus;
import com.vidrecorder.model.StartRecordingRequest;
import com.vidrecorder.model.UploadCompleteRequest;
import com.vidrecorder.model.UploadInitRequest;
import com.vidrecorder.model.UploadInitResponse;
import com.vidrecorder.security.RecordingUser;
import com.vidrecorder.storage.BlobStoreService;
import com.vidrecorder.upload.ChunkedUploadAssembler;
import com.vidrecorder.upload.ScratchStorageService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives recording jobs through {@code recording -> processing -> completed}, with {@code failed}
 * reachable from either active state, and keeps each room down to one active job.
 * <p>
 * Exclusivity is checked here first so stale jobs can be reconciled, and enforced again by the
 * store's unique active-room column, so two concurrent starts cannot both succeed.
 */
@Service
@Slf4j
public class RecordingLifecycleService {

    private final RecordingMetadataStore store;
    private final BlobStoreService blobStore;
    private final ChunkedUploadAssembler assembler;
    private final ScratchStorageService scratchStorage;
    private final ValidationService validationService;
    private final RecordingPolicyConfig policy;
    private final Clock clock;
    private final long chunkSizeBytes;
    private final int maxChunks;
    private final long maxChunkBytes;

    public RecordingLifecycleService(RecordingMetadataStore store,
                                     BlobStoreService blobStore,
                                     ChunkedUploadAssembler assembler,
                                     ScratchStorageService scratchStorage,
                                     ValidationService validationService,
                                     RecordingPolicyConfig policy,
                                     Clock clock,
                                     @Value("${recording.upload.chunk-size:5MB}") DataSize chunkSize,
                                     @Value("${recording.upload.max-chunks:10000}") int maxChunks,
                                     @Value("${recording.upload.max-chunk-size:10MB}") DataSize maxChunkSize) {
        this.store = store;
        this.blobStore = blobStore;
        this.assembler = assembler;
        this.scratchStorage = scratchStorage;
        this.validationService = validationService;
        this.policy = policy;
        this.clock = clock;
        this.chunkSizeBytes = chunkSize.toBytes();
        this.maxChunks = maxChunks;
        this.maxChunkBytes = maxChunkSize.toBytes();
    }

    /**
     * Starts a new recording for the room. A stale active job is failed first; any other active job
     * makes the start fail with {@link RecordingConflictException}.
     */
    public RecordingJob start(RecordingUser user, StartRecordingRequest request) {
        validationService.validateRoomFields(request.getRoomId(), request.getRoomCode(), request.getRoomName());
        Instant now = clock.instant();

        store.getActive(request.getRoomId()).ifPresent(active -> {
            if (!isStale(active, now)) {
                throw new RecordingConflictException(request.getRoomId(), active.getId());
            }
            log.warn("Recording {} in room {} went stale (started {}), failing it before a new start",
                    active.getId(), active.getRoomId(), active.getStartTime());
            markFailed(active.getId(), "Recording timed out: no stop signal within " + policy.getLivenessTimeout());
        });

        RecordingJob job = RecordingJob.builder()
                .roomId(request.getRoomId())
                .roomCode(request.getRoomCode())
                .roomName(request.getRoomName())
                .ownerId(user.id())
                .ownerName(user.name())
                .participantIds(cleanParticipants(request.getParticipantIds()))
                .status(RecordingStatus.RECORDING)
                .startTime(now)
                .build();

        String id = store.create(job);
        log.info("Recording session started: {} (room {}, owner {})", id, request.getRoomId(), user.id());
        return require(id);
    }

    public RecordingJob stop(RecordingUser user, String recordingId, Long durationSeconds) {
        RecordingJob job = require(recordingId);
        requireReader(user, job, "stop");
        requireStatus(job, RecordingStatus.RECORDING, "stop");

        Instant end = clock.instant();
        long duration = durationSeconds != null && durationSeconds >= 0
                ? durationSeconds
                : Duration.between(job.getStartTime(), end).getSeconds();

        RecordingJob stopped = store.update(recordingId, RecordingJobPatch.builder()
                .expectedStatus(RecordingStatus.RECORDING)
                .status(RecordingStatus.PROCESSING)
                .endTime(end)
                .durationSeconds(duration)
                .build());
        log.info("Recording stopped: {} ({}s)", recordingId, duration);
        return stopped;
    }

    /**
     * Accepts the finished file in one piece and offloads it to the blob store.
     */
    public RecordingJob uploadRecording(RecordingUser user, String recordingId, MultipartFile file,
                                        Collection<String> participants) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No video file provided");
        }
        RecordingJob job = require(recordingId);
        requireOwner(user, job, "upload");
        String extension = validationService.validateRecordingFileName(file.getOriginalFilename());
        requireStatus(job, RecordingStatus.PROCESSING, "upload");

        Path saved;
        try {
            saved = scratchStorage.saveRecording(recordingId, file, extension);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to store uploaded recording", e);
        }
        return offload(job, saved, participants);
    }

    public UploadInitResponse initChunkedUpload(RecordingUser user, String recordingId, UploadInitRequest request) {
        RecordingJob job = require(recordingId);
        requireOwner(user, job, "upload");
        requireActive(job, "upload");
        if (request.getTotalChunks() == null) {
            throw new IllegalArgumentException("totalChunks is required");
        }
        validationService.validateChunk(0, request.getTotalChunks(), maxChunks);
        if (request.getFileName() != null) {
            validationService.validateRecordingFileName(request.getFileName());
        }

        String uploadId = assembler.initUpload(recordingId, request.getTotalChunks(),
                request.getFileName(), request.getFileSize());
        return new UploadInitResponse(uploadId, chunkSizeBytes, request.getTotalChunks(), "Upload initialized");
    }

    public ChunkReceipt putChunk(RecordingUser user, String recordingId, String uploadId, int chunkIndex,
                                 Integer totalChunks, MultipartFile chunk) {
        if (chunk == null || chunk.isEmpty()) {
            throw new IllegalArgumentException("No chunk provided");
        }
        if (chunk.getSize() > maxChunkBytes) {
            throw new IllegalArgumentException("Chunk exceeds the maximum size of " + maxChunkBytes + " bytes");
        }
        RecordingJob job = require(recordingId);
        requireOwner(user, job, "upload");
        requireActive(job, "upload");
        validationService.validateUploadId(uploadId);
        if (totalChunks != null) {
            validationService.validateChunk(chunkIndex, totalChunks, maxChunks);
        }

        try (InputStream in = chunk.getInputStream()) {
            assembler.putChunk(recordingId, uploadId, chunkIndex, totalChunks, in);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to read chunk " + chunkIndex, e);
        }
        String of = totalChunks != null ? String.valueOf(totalChunks) : "?";
        return new ChunkReceipt(uploadId, chunkIndex, true, "Chunk " + (chunkIndex + 1) + "/" + of + " uploaded");
    }

    /**
     * Assembles a chunked upload and offloads the result. A missing chunk surfaces as
     * {@link com.vidrecorder.exception.IncompleteUploadException} and leaves the job untouched.
     */
    public RecordingJob completeChunkedUpload(RecordingUser user, String recordingId, UploadCompleteRequest request) {
        RecordingJob job = require(recordingId);
        requireOwner(user, job, "upload");
        requireStatus(job, RecordingStatus.PROCESSING, "complete upload for");
        validationService.validateUploadId(request.getUploadId());
        if (request.getFileName() != null) {
            validationService.validateRecordingFileName(request.getFileName());
        }

        Path assembled = assembler.complete(recordingId, request.getUploadId(), request.getFileName());
        return offload(job, assembled, request.getParticipants());
    }

    /**
     * Re-attempts the offload of a scratch file preserved by an earlier storage failure.
     */
    public RecordingJob retryOffload(RecordingUser user, String recordingId) {
        RecordingJob job = require(recordingId);
        requireOwner(user, job, "upload");
        requireStatus(job, RecordingStatus.PROCESSING, "retry upload for");
        if (job.getScratchFilePath() == null || !Files.isRegularFile(Path.of(job.getScratchFilePath()))) {
            throw new RecordingNotFoundException("No preserved recording file to retry for " + recordingId);
        }
        return offload(job, Path.of(job.getScratchFilePath()), null);
    }

    public RecordingJob fail(RecordingUser user, String recordingId, String reason) {
        RecordingJob job = require(recordingId);
        requireOwner(user, job, "fail");
        requireActive(job, "fail");
        return markFailed(recordingId, reason == null || reason.isBlank() ? "Failed by owner" : reason.trim());
    }

    /**
     * Operator escape hatch: fails whatever job is active in the room.
     */
    public RecordingJob cleanupRoom(String roomId) {
        RecordingJob active = store.getActive(roomId)
                .orElseThrow(() -> new RecordingNotFoundException("No active recording found for room " + roomId));
        RecordingJob failed = markFailed(active.getId(), "Cleanup requested by user");
        log.info("Stale recording cleaned up: {} (room {})", failed.getId(), roomId);
        return failed;
    }

    public List<RecordingJob> listVisible(RecordingUser user) {
        return store.listForUser(user.id());
    }

    public List<RecordingJob> listRoom(RecordingUser user, String roomId) {
        return store.listByRoom(roomId).stream()
                .filter(job -> job.isReadableBy(user.id()))
                .toList();
    }

    public RecordingJob get(RecordingUser user, String recordingId) {
        RecordingJob job = require(recordingId);
        requireReader(user, job, "access");
        return job;
    }

    public DownloadUrlResponse downloadUrl(RecordingUser user, String recordingId) {
        RecordingJob job = require(recordingId);
        requireReader(user, job, "download");
        if (job.getStorageLocator() == null) {
            throw new RecordingNotFoundException("Recording file not found for " + recordingId);
        }
        Duration ttl = policy.getDownloadUrlTtl();
        String url = blobStore.signedDownloadUrl(job.getStorageLocator(), ttl);
        return new DownloadUrlResponse(recordingId, url, ttl.getSeconds(), "Download URL generated successfully");
    }

    /**
     * Owner-only delete: blob first, then metadata. A blob delete failure is logged and does not keep
     * the metadata record alive.
     */
    public void delete(RecordingUser user, String recordingId) {
        RecordingJob job = require(recordingId);
        requireOwner(user, job, "delete");

        if (job.getStorageLocator() != null) {
            try {
                blobStore.delete(job.getStorageLocator());
            } catch (StorageFailureException e) {
                log.error("Failed to delete blob {} of recording {}, deleting metadata anyway",
                        job.getStorageLocator(), recordingId, e);
            }
        }
        scratchStorage.discard(job.getScratchFilePath());
        assembler.discardSessionsFor(recordingId);
        store.delete(recordingId);
        log.info("Recording deleted: {}", recordingId);
    }

    /**
     * Moves an active job to {@code failed}, recording the reason and discarding its scratch artifacts.
     * Jobs that already reached a terminal state are returned unchanged.
     */
    public RecordingJob markFailed(String recordingId, String reason) {
        RecordingJob job = require(recordingId);
        if (job.getStatus().isTerminal()) {
            return job;
        }
        RecordingJob failed = store.update(recordingId, RecordingJobPatch.builder()
                .expectedStatus(job.getStatus())
                .status(RecordingStatus.FAILED)
                .errorDetail(reason)
                .endTime(job.getEndTime() == null ? clock.instant() : null)
                .clearScratchFilePath(true)
                .build());

        scratchStorage.discard(job.getScratchFilePath());
        assembler.discardSessionsFor(recordingId);
        log.info("Recording {} failed: {}", recordingId, reason);
        return failed;
    }

    /**
     * A job is stale once it has been recording longer than the liveness timeout without a stop.
     */
    public boolean isStale(RecordingJob job, Instant now) {
        return job.getStatus() == RecordingStatus.RECORDING
                && job.getEndTime() == null
                && job.getStartTime().plus(policy.getLivenessTimeout()).isBefore(now);
    }

    private RecordingJob offload(RecordingJob job, Path file, Collection<String> participants) {
        String recordingId = job.getId();
        if (job.getScratchFilePath() != null && !Path.of(job.getScratchFilePath()).equals(file)) {
            scratchStorage.discard(job.getScratchFilePath());
        }
        try {
            store.update(recordingId, RecordingJobPatch.builder()
                    .expectedStatus(RecordingStatus.PROCESSING)
                    .scratchFilePath(file.toString())
                    .addParticipantIds(cleanParticipants(participants))
                    .build());
        } catch (RuntimeException e) {
            if (!file.toString().equals(job.getScratchFilePath())) {
                // Nothing references the new file yet
                scratchStorage.discard(file.toString());
            }
            throw e;
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new StorageFailureException("Recording file is not readable", e);
        }

        String objectName = objectNameFor(job, file);
        log.info("Uploading recording {} to {} blob store as {} ({} bytes)",
                recordingId, blobStore.backendName(), objectName, size);
        // Throws StorageFailureException with the scratch file left in place for a retry
        String url = blobStore.upload(file, objectName);

        Instant end = job.getEndTime() != null ? job.getEndTime() : clock.instant();
        RecordingJob completed;
        try {
            completed = store.update(recordingId, RecordingJobPatch.builder()
                    .expectedStatus(RecordingStatus.PROCESSING)
                    .status(RecordingStatus.COMPLETED)
                    .storageLocator(objectName)
                    .storageUrl(url)
                    .fileSizeBytes(size)
                    .retentionDeadline(end.plus(policy.getRetentionWindow()))
                    .clearScratchFilePath(true)
                    .build());
        } catch (RuntimeException e) {
            // The job moved on (failed or deleted) while we were uploading
            log.warn("Recording {} changed during upload, removing orphaned blob {}", recordingId, objectName);
            try {
                blobStore.delete(objectName);
            } catch (StorageFailureException deleteFailure) {
                log.error("Failed to remove orphaned blob {}", objectName, deleteFailure);
            }
            throw e;
        }
        scratchStorage.discard(file.toString());
        log.info("Recording uploaded successfully: {} (retained until {})", recordingId, completed.getRetentionDeadline());
        return completed;
    }

    private static String objectNameFor(RecordingJob job, Path file) {
        String extension = FilenameUtils.getExtension(file.getFileName().toString());
        String roomCode = job.getRoomCode().replaceAll("[^A-Za-z0-9_-]", "_");
        return roomCode + "-" + job.getId() + (extension.isEmpty() ? ".webm" : "." + extension.toLowerCase());
    }

    private static Set<String> cleanParticipants(Collection<String> participants) {
        if (participants == null) {
            return new HashSet<>();
        }
        return participants.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(String::trim)
                .collect(Collectors.toCollection(HashSet::new));
    }

    private RecordingJob require(String recordingId) {
        return store.get(recordingId).orElseThrow(() -> RecordingNotFoundException.forId(recordingId));
    }

    private static void requireOwner(RecordingUser user, RecordingJob job, String action) {
        if (!job.isOwnedBy(user.id())) {
            throw new RecordingForbiddenException("Unauthorized to " + action + " this recording");
        }
    }

    private static void requireReader(RecordingUser user, RecordingJob job, String action) {
        if (!job.isReadableBy(user.id())) {
            throw new RecordingForbiddenException("Unauthorized to " + action + " this recording");
        }
    }

    private static void requireStatus(RecordingJob job, RecordingStatus expected, String action) {
        if (job.getStatus() != expected) {
            throw new InvalidRecordingStateException(job.getId(), job.getStatus(), action);
        }
    }

    private static void requireActive(RecordingJob job, String action) {
        if (!job.getStatus().isActive()) {
            throw new InvalidRecordingStateException(job.getId(), job.getStatus(), action);
        }
    }
}
