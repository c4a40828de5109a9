package com.vidrecorder.service;

import com.vidrecorder.exception.InvalidRecordingStateException;
import com.vidrecorder.exception.RecordingConflictException;
import com.vidrecorder.model.RecordingJob;
import com.vidrecorder.model.RecordingJobPatch;
import com.vidrecorder.model.RecordingStatus;
import com.vidrecorder.repository.RecordingJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs without a surrounding test transaction so every store call commits on its own, the way the
 * service uses it.
 */
@DataJpaTest
@Import(JpaRecordingMetadataStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaRecordingMetadataStoreTest {

	private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

	@Autowired
	private JpaRecordingMetadataStore store;

	@Autowired
	private RecordingJobRepository repository;

	@BeforeEach
	void cleanUp() {
		repository.deleteAll();
	}

	@Test
	void createdJobIsReadBackWithParticipants() {
		String id = store.create(job("room-1", "owner", RecordingStatus.RECORDING, T0, Set.of("guest-a", "guest-b")));

		RecordingJob stored = store.get(id).orElseThrow();
		assertThat(stored.getRoomCode()).isEqualTo("CODE-room-1");
		assertThat(stored.getParticipantIds()).containsExactlyInAnyOrder("guest-a", "guest-b");
		assertThat(stored.getActiveRoomId()).isEqualTo("room-1");
		assertThat(store.getActive("room-1")).map(RecordingJob::getId).contains(id);
	}

	@Test
	void secondActiveJobForARoomIsAConflict() {
		String first = store.create(job("room-1", "owner", RecordingStatus.RECORDING, T0, Set.of()));

		assertThatThrownBy(() -> store.create(job("room-1", "other", RecordingStatus.RECORDING, T0.plusSeconds(5), Set.of())))
				.isInstanceOf(RecordingConflictException.class)
				.satisfies(e -> assertThat(((RecordingConflictException) e).getActiveRecordingId()).isEqualTo(first));
		assertThat(store.listByRoom("room-1")).hasSize(1);
	}

	@Test
	void terminalJobFreesTheRoom() {
		String first = store.create(job("room-1", "owner", RecordingStatus.RECORDING, T0, Set.of()));
		store.update(first, RecordingJobPatch.builder()
				.expectedStatus(RecordingStatus.RECORDING)
				.status(RecordingStatus.FAILED)
				.errorDetail("timed out")
				.build());

		String second = store.create(job("room-1", "owner", RecordingStatus.RECORDING, T0.plusSeconds(60), Set.of()));

		assertThat(store.get(first).orElseThrow().getActiveRoomId()).isNull();
		assertThat(store.getActive("room-1")).map(RecordingJob::getId).contains(second);
		assertThat(store.listByRoom("room-1")).extracting(RecordingJob::getId).containsExactly(second, first);
	}

	@Test
	void updateMergesOnlyTheGivenFields() {
		String id = store.create(job("room-1", "owner", RecordingStatus.PROCESSING, T0, Set.of("guest-a")));

		RecordingJob updated = store.update(id, RecordingJobPatch.builder()
				.scratchFilePath("/tmp/recording.webm")
				.addParticipantIds(Set.of("guest-b"))
				.build());

		assertThat(updated.getScratchFilePath()).isEqualTo("/tmp/recording.webm");
		assertThat(updated.getStatus()).isEqualTo(RecordingStatus.PROCESSING);
		assertThat(updated.getRoomName()).isEqualTo("Room room-1");
		assertThat(updated.getParticipantIds()).containsExactlyInAnyOrder("guest-a", "guest-b");

		RecordingJob cleared = store.update(id, RecordingJobPatch.builder().clearScratchFilePath(true).build());
		assertThat(cleared.getScratchFilePath()).isNull();
		assertThat(cleared.getParticipantIds()).hasSize(2);
	}

	@Test
	void updateFromUnexpectedStatusIsRejected() {
		String id = store.create(job("room-1", "owner", RecordingStatus.RECORDING, T0, Set.of()));

		assertThatThrownBy(() -> store.update(id, RecordingJobPatch.builder()
				.expectedStatus(RecordingStatus.PROCESSING)
				.status(RecordingStatus.COMPLETED)
				.build()))
				.isInstanceOf(InvalidRecordingStateException.class);
		assertThat(store.get(id).orElseThrow().getStatus()).isEqualTo(RecordingStatus.RECORDING);
	}

	@Test
	void onlyCompletedJobsPastTheirDeadlineAreExpired() {
		Instant now = T0.plus(Duration.ofDays(4));
		String expired = store.create(withDeadline(job("room-1", "owner", RecordingStatus.COMPLETED, T0, Set.of()), now.minusSeconds(1)));
		String onDeadline = store.create(withDeadline(job("room-2", "owner", RecordingStatus.COMPLETED, T0, Set.of()), now));
		store.create(withDeadline(job("room-3", "owner", RecordingStatus.COMPLETED, T0, Set.of()), now.plusSeconds(1)));
		store.create(withDeadline(job("room-4", "owner", RecordingStatus.FAILED, T0, Set.of()), now.minusSeconds(60)));

		assertThat(store.listExpired(now)).extracting(RecordingJob::getId).containsExactlyInAnyOrder(expired, onDeadline);
	}

	@Test
	void usersSeeJobsTheyOwnOrTookPartIn() {
		String owned = store.create(job("room-1", "alice", RecordingStatus.COMPLETED, T0, Set.of("bob")));
		String joined = store.create(job("room-2", "carol", RecordingStatus.COMPLETED, T0.plusSeconds(60), Set.of("alice", "bob")));
		store.create(job("room-3", "carol", RecordingStatus.COMPLETED, T0.plusSeconds(120), Set.of()));

		assertThat(store.listForUser("alice")).extracting(RecordingJob::getId).containsExactly(joined, owned);
		assertThat(store.listForUser("bob")).extracting(RecordingJob::getId).containsExactly(joined, owned);
		assertThat(store.listForUser("dave")).isEmpty();
	}

	@Test
	void deleteReportsWhetherAnythingWasRemoved() {
		String id = store.create(job("room-1", "owner", RecordingStatus.COMPLETED, T0, Set.of("guest")));

		assertThat(store.delete(id)).isTrue();
		assertThat(store.delete(id)).isFalse();
		assertThat(store.get(id)).isEmpty();
	}

	private static RecordingJob job(String roomId, String ownerId, RecordingStatus status, Instant start,
									Set<String> participants) {
		return RecordingJob.builder()
				.roomId(roomId)
				.roomCode("CODE-" + roomId)
				.roomName("Room " + roomId)
				.ownerId(ownerId)
				.ownerName(ownerId)
				.participantIds(new HashSet<>(participants))
				.status(status)
				.startTime(start)
				.build();
	}

	private static RecordingJob withDeadline(RecordingJob job, Instant deadline) {
		job.setRetentionDeadline(deadline);
		return job;
	}
}
