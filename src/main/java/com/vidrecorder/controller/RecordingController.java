package com.vidrecorder.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidrecorder.model.ChunkReceipt;
import com.vidrecorder.model.DownloadUrlResponse;
import com.vidrecorder.model.FailRecordingRequest;
import com.vidrecorder.model.RecordingActionResponse;
import com.vidrecorder.model.RecordingJob;
import com.vidrecorder.model.RecordingView;
import com.vidrecorder.model.StartRecordingRequest;
import com.vidrecorder.model.StopRecordingRequest;
import com.vidrecorder.model.UploadCompleteRequest;
import com.vidrecorder.model.UploadInitRequest;
import com.vidrecorder.model.UploadInitResponse;
import com.vidrecorder.security.CurrentUserService;
import com.vidrecorder.security.RecordingUser;
import com.vidrecorder.service.RecordingLifecycleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/recordings")
@Slf4j
public class RecordingController {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    @Autowired
    private RecordingLifecycleService lifecycleService;

    @Autowired
    private CurrentUserService currentUserService;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * Starts a recording for a room; 409 when the room already has an active recording
     */
    @PostMapping("/start")
    public ResponseEntity<RecordingActionResponse> start(@RequestBody StartRecordingRequest request) {
        RecordingUser user = currentUserService.requireCurrentUser();
        log.info("User {} starting recording for room {}", user.id(), request.getRoomId());

        RecordingJob job = lifecycleService.start(user, request);
        RecordingActionResponse response = RecordingActionResponse.of(job, "Recording started successfully");
        response.setStartTime(job.getStartTime());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{recordingId}/stop")
    public ResponseEntity<RecordingActionResponse> stop(@PathVariable String recordingId,
                                                        @RequestBody(required = false) StopRecordingRequest request) {
        RecordingUser user = currentUserService.requireCurrentUser();
        Long duration = request != null ? request.getDuration() : null;

        RecordingJob job = lifecycleService.stop(user, recordingId, duration);
        return ResponseEntity.ok(RecordingActionResponse.of(job, "Recording stopped, waiting for upload"));
    }

    /**
     * Single-request upload of the finished recording (multipart field {@code video})
     */
    @PostMapping(value = "/{recordingId}/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RecordingActionResponse> upload(@PathVariable String recordingId,
                                                          @RequestParam("video") MultipartFile video,
                                                          @RequestParam(value = "participants", required = false) String participants) {
        RecordingUser user = currentUserService.requireCurrentUser();
        log.info("User {} uploading recording {} ({} bytes)", user.id(), recordingId, video.getSize());

        RecordingJob job = lifecycleService.uploadRecording(user, recordingId, video, parseParticipants(participants));
        return ResponseEntity.ok(completed(job));
    }

    @PostMapping("/{recordingId}/upload/init")
    public ResponseEntity<UploadInitResponse> initUpload(@PathVariable String recordingId,
                                                         @RequestBody UploadInitRequest request) {
        RecordingUser user = currentUserService.requireCurrentUser();
        return ResponseEntity.ok(lifecycleService.initChunkedUpload(user, recordingId, request));
    }

    @PostMapping(value = "/{recordingId}/upload/chunk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ChunkReceipt> uploadChunk(@PathVariable String recordingId,
                                                    @RequestParam("uploadId") String uploadId,
                                                    @RequestParam("chunkIndex") int chunkIndex,
                                                    @RequestParam(value = "totalChunks", required = false) Integer totalChunks,
                                                    @RequestParam("chunk") MultipartFile chunk) {
        RecordingUser user = currentUserService.requireCurrentUser();
        return ResponseEntity.ok(lifecycleService.putChunk(user, recordingId, uploadId, chunkIndex, totalChunks, chunk));
    }

    @PostMapping("/{recordingId}/upload/complete")
    public ResponseEntity<RecordingActionResponse> completeUpload(@PathVariable String recordingId,
                                                                  @RequestBody UploadCompleteRequest request) {
        RecordingUser user = currentUserService.requireCurrentUser();
        log.info("User {} completing chunked upload {} of recording {}", user.id(), request.getUploadId(), recordingId);

        RecordingJob job = lifecycleService.completeChunkedUpload(user, recordingId, request);
        return ResponseEntity.ok(completed(job));
    }

    /**
     * Retries the offload of a recording whose earlier upload hit a storage failure
     */
    @PostMapping("/{recordingId}/upload/retry")
    public ResponseEntity<RecordingActionResponse> retryUpload(@PathVariable String recordingId) {
        RecordingUser user = currentUserService.requireCurrentUser();
        RecordingJob job = lifecycleService.retryOffload(user, recordingId);
        return ResponseEntity.ok(completed(job));
    }

    @PostMapping("/{recordingId}/fail")
    public ResponseEntity<RecordingActionResponse> fail(@PathVariable String recordingId,
                                                        @RequestBody(required = false) FailRecordingRequest request) {
        RecordingUser user = currentUserService.requireCurrentUser();
        String reason = request != null ? request.getReason() : null;

        RecordingJob job = lifecycleService.fail(user, recordingId, reason);
        return ResponseEntity.ok(RecordingActionResponse.of(job, "Recording marked as failed"));
    }

    @GetMapping
    public ResponseEntity<List<RecordingView>> list() {
        RecordingUser user = currentUserService.requireCurrentUser();
        List<RecordingView> recordings = lifecycleService.listVisible(user).stream()
                .map(RecordingView::from)
                .toList();
        return ResponseEntity.ok(recordings);
    }

    @GetMapping("/{recordingId}")
    public ResponseEntity<RecordingView> get(@PathVariable String recordingId) {
        RecordingUser user = currentUserService.requireCurrentUser();
        return ResponseEntity.ok(RecordingView.from(lifecycleService.get(user, recordingId)));
    }

    @GetMapping("/{recordingId}/download")
    public ResponseEntity<DownloadUrlResponse> download(@PathVariable String recordingId) {
        RecordingUser user = currentUserService.requireCurrentUser();
        log.info("User {} requested download URL for recording {}", user.id(), recordingId);
        return ResponseEntity.ok(lifecycleService.downloadUrl(user, recordingId));
    }

    @DeleteMapping("/{recordingId}")
    public ResponseEntity<RecordingActionResponse> delete(@PathVariable String recordingId) {
        RecordingUser user = currentUserService.requireCurrentUser();
        lifecycleService.delete(user, recordingId);
        return ResponseEntity.ok(RecordingActionResponse.builder()
                .recordingId(recordingId)
                .message("Recording deleted successfully")
                .build());
    }

    /**
     * Fails whatever recording is stuck active in the room so a new one can start
     */
    @PostMapping("/cleanup/{roomId}")
    public ResponseEntity<RecordingActionResponse> cleanupRoom(@PathVariable String roomId) {
        RecordingUser user = currentUserService.requireCurrentUser();
        log.info("User {} requested cleanup of active recording in room {}", user.id(), roomId);

        RecordingJob job = lifecycleService.cleanupRoom(roomId);
        return ResponseEntity.ok(RecordingActionResponse.of(job,
                "Stale recording has been cleaned up. You can now start a new recording."));
    }

    private static RecordingActionResponse completed(RecordingJob job) {
        RecordingActionResponse response = RecordingActionResponse.of(job, "Recording uploaded successfully");
        response.setFileSizeBytes(job.getFileSizeBytes());
        return response;
    }

    // Accepts a JSON array or a comma-separated list
    private List<String> parseParticipants(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                return objectMapper.readValue(trimmed, STRING_LIST);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("participants must be a JSON array of user ids");
            }
        }
        return Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
