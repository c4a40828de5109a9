package com.vidrecorder.service;

import com.vidrecorder.exception.InvalidRecordingStateException;
import com.vidrecorder.exception.RecordingConflictException;
import com.vidrecorder.exception.RecordingNotFoundException;
import com.vidrecorder.model.RecordingJob;
import com.vidrecorder.model.RecordingJobPatch;
import com.vidrecorder.model.RecordingStatus;
import com.vidrecorder.repository.RecordingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaRecordingMetadataStore implements RecordingMetadataStore {

    private final RecordingJobRepository repository;

    // Not transactional: the conflict lookup below runs after the failed insert
    @Override
    public String create(RecordingJob job) {
        try {
            RecordingJob saved = repository.saveAndFlush(job);
            log.debug("Created recording {} for room {}", saved.getId(), saved.getRoomId());
            return saved.getId();
        } catch (DataIntegrityViolationException e) {
            // Lost the race on the unique active-room column
            String activeId = repository
                    .findFirstByRoomIdAndStatusInOrderByStartTimeDesc(job.getRoomId(), RecordingStatus.ACTIVE)
                    .map(RecordingJob::getId)
                    .orElse(null);
            throw new RecordingConflictException(job.getRoomId(), activeId);
        }
    }

    @Override
    @Transactional
    public RecordingJob update(String id, RecordingJobPatch patch) {
        RecordingJob job = repository.findById(id)
                .orElseThrow(() -> RecordingNotFoundException.forId(id));
        if (patch.getExpectedStatus() != null && job.getStatus() != patch.getExpectedStatus()) {
            throw new InvalidRecordingStateException(id, job.getStatus(),
                    "move to " + (patch.getStatus() == null ? "next state" : patch.getStatus().wireName()));
        }
        patch.applyTo(job);
        return repository.saveAndFlush(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RecordingJob> get(String id) {
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecordingJob> listByRoom(String roomId) {
        return repository.findByRoomIdOrderByStartTimeDesc(roomId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecordingJob> listForUser(String userId) {
        return repository.findVisibleTo(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RecordingJob> getActive(String roomId) {
        return repository.findFirstByRoomIdAndStatusInOrderByStartTimeDesc(roomId, RecordingStatus.ACTIVE);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecordingJob> listExpired(Instant now) {
        return repository.findByStatusAndRetentionDeadlineLessThanEqual(RecordingStatus.COMPLETED, now);
    }

    @Override
    @Transactional
    public boolean delete(String id) {
        if (!repository.existsById(id)) {
            return false;
        }
        repository.deleteById(id);
        return true;
    }
}
