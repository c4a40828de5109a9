package com.vidrecorder.repository;

import com.vidrecorder.model.RecordingJob;
import com.vidrecorder.model.RecordingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RecordingJobRepository extends JpaRepository<RecordingJob, String> {

    List<RecordingJob> findByRoomIdOrderByStartTimeDesc(String roomId);

    Optional<RecordingJob> findFirstByRoomIdAndStatusInOrderByStartTimeDesc(String roomId, Collection<RecordingStatus> statuses);

    @Query("select distinct r from RecordingJob r left join r.participantIds p "
            + "where r.ownerId = :userId or p = :userId order by r.startTime desc")
    List<RecordingJob> findVisibleTo(@Param("userId") String userId);

    List<RecordingJob> findByStatusAndRetentionDeadlineLessThanEqual(RecordingStatus status, Instant deadline);
}
