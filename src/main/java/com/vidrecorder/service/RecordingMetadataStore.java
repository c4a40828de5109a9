package com.vidrecorder.service;

import com.vidrecorder.model.RecordingJob;
import com.vidrecorder.model.RecordingJobPatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable records of recording jobs. Every read returns a fully materialized job.
 */
public interface RecordingMetadataStore {

    /**
     * Persists a new job and returns its assigned id.
     *
     * @throws com.vidrecorder.exception.RecordingConflictException if the room already has an active job
     */
    String create(RecordingJob job);

    /**
     * Merges the non-null fields of {@code patch} into the stored job.
     *
     * @throws com.vidrecorder.exception.RecordingNotFoundException if no job has this id
     * @throws com.vidrecorder.exception.InvalidRecordingStateException if {@code patch.expectedStatus} does not match
     */
    RecordingJob update(String id, RecordingJobPatch patch);

    Optional<RecordingJob> get(String id);

    List<RecordingJob> listByRoom(String roomId);

    /** Jobs owned by or shared with the user, newest first. */
    List<RecordingJob> listForUser(String userId);

    /** The job in {@code recording} or {@code processing} state for the room, if any. */
    Optional<RecordingJob> getActive(String roomId);

    /** Completed jobs whose retention deadline is at or before {@code now}. */
    List<RecordingJob> listExpired(Instant now);

    /** @return false if the job was already gone */
    boolean delete(String id);
}
