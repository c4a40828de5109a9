package com.vidrecorder.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidrecorder.config.RecordingPolicyConfig;
import com.vidrecorder.exception.IncompleteUploadException;
import com.vidrecorder.exception.InvalidRecordingStateException;
import com.vidrecorder.exception.RecordingConflictException;
import com.vidrecorder.exception.RecordingForbiddenException;
import com.vidrecorder.exception.RecordingNotFoundException;
import com.vidrecorder.exception.StorageFailureException;
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
import com.vidrecorder.support.InMemoryRecordingMetadataStore;
import com.vidrecorder.support.MutableClock;
import com.vidrecorder.upload.ChunkedUploadAssembler;
import com.vidrecorder.upload.ScratchStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecordingLifecycleServiceTest {

	private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

	private final RecordingUser owner = new RecordingUser("user-owner", "Owner");
	private final RecordingUser participant = new RecordingUser("user-guest", "Guest");
	private final RecordingUser stranger = new RecordingUser("user-stranger", "Stranger");

	@TempDir
	Path tempDir;

	private MutableClock clock;
	private InMemoryRecordingMetadataStore store;
	private BlobStoreService blobStore;
	private ScratchStorageService scratchStorage;
	private ChunkedUploadAssembler assembler;
	private RecordingLifecycleService service;

	@BeforeEach
	void setUp() throws IOException {
		clock = new MutableClock(T0);
		store = new InMemoryRecordingMetadataStore();
		blobStore = mock(BlobStoreService.class);
		when(blobStore.backendName()).thenReturn("mock");
		scratchStorage = new ScratchStorageService(tempDir.resolve("recordings").toString());
		assembler = new ChunkedUploadAssembler(tempDir.resolve("chunks").toString(), scratchStorage,
				new ObjectMapper(), clock);
		service = serviceWith(store);
	}

	@Test
	void startCreatesRecordingJob() {
		RecordingJob job = start("room-1");

		assertThat(job.getId()).isNotBlank();
		assertThat(job.getStatus()).isEqualTo(RecordingStatus.RECORDING);
		assertThat(job.getStartTime()).isEqualTo(T0);
		assertThat(job.getOwnerId()).isEqualTo(owner.id());
		assertThat(job.getParticipantIds()).containsExactly(participant.id());
		assertThat(job.getRetentionDeadline()).isNull();
	}

	@Test
	void secondStartInActiveRoomConflicts() {
		RecordingJob first = start("room-1");
		clock.advance(Duration.ofMinutes(4));

		assertThatThrownBy(() -> start("room-1"))
				.isInstanceOf(RecordingConflictException.class)
				.satisfies(e -> assertThat(((RecordingConflictException) e).getActiveRecordingId()).isEqualTo(first.getId()));

		// Other rooms are unaffected
		assertThat(start("room-2").getStatus()).isEqualTo(RecordingStatus.RECORDING);
	}

	@Test
	void staleRecordingIsFailedBeforeANewStart() {
		RecordingJob stale = start("room-1");
		clock.advance(Duration.ofMinutes(6));

		RecordingJob fresh = start("room-1");

		RecordingJob reconciled = service.get(owner, stale.getId());
		assertThat(reconciled.getStatus()).isEqualTo(RecordingStatus.FAILED);
		assertThat(reconciled.getErrorDetail()).contains("timed out");
		assertThat(reconciled.getEndTime()).isEqualTo(T0.plus(Duration.ofMinutes(6)));
		assertThat(fresh.getStatus()).isEqualTo(RecordingStatus.RECORDING);
	}

	@Test
	void processingJobIsNeverStale() {
		RecordingJob job = start("room-1");
		service.stop(owner, job.getId(), null);
		clock.advance(Duration.ofHours(2));

		assertThatThrownBy(() -> start("room-1")).isInstanceOf(RecordingConflictException.class);
	}

	@Test
	void stopDerivesDurationWhenNotReported() {
		RecordingJob job = start("room-1");
		clock.advance(Duration.ofSeconds(90));

		RecordingJob stopped = service.stop(owner, job.getId(), null);

		assertThat(stopped.getStatus()).isEqualTo(RecordingStatus.PROCESSING);
		assertThat(stopped.getEndTime()).isEqualTo(T0.plusSeconds(90));
		assertThat(stopped.getDurationSeconds()).isEqualTo(90L);
		assertThat(service.stop(owner, start("room-2").getId(), 42L).getDurationSeconds()).isEqualTo(42L);
	}

	@Test
	void stoppingTwiceIsRejected() {
		RecordingJob job = start("room-1");
		service.stop(owner, job.getId(), null);

		assertThatThrownBy(() -> service.stop(owner, job.getId(), null))
				.isInstanceOf(InvalidRecordingStateException.class);
		assertThatThrownBy(() -> service.stop(stranger, job.getId(), null))
				.isInstanceOf(RecordingForbiddenException.class);
	}

	@Test
	void uploadCompletesJobAndSetsRetentionDeadline() {
		RecordingJob job = startAndStop("room-1", Duration.ofMinutes(2));
		when(blobStore.upload(any(Path.class), anyString())).thenReturn("https://blobs/ROOM-room-1.webm");

		RecordingJob completed = service.uploadRecording(owner, job.getId(), video("meeting.webm"), List.of("user-late"));

		assertThat(completed.getStatus()).isEqualTo(RecordingStatus.COMPLETED);
		assertThat(completed.getStorageLocator()).isEqualTo("ROOM-room-1-" + job.getId() + ".webm");
		assertThat(completed.getStorageUrl()).isEqualTo("https://blobs/ROOM-room-1.webm");
		assertThat(completed.getFileSizeBytes()).isEqualTo(11L);
		assertThat(completed.getRetentionDeadline()).isEqualTo(completed.getEndTime().plus(Duration.ofDays(3)));
		assertThat(completed.getScratchFilePath()).isNull();
		assertThat(completed.getParticipantIds()).contains(participant.id(), "user-late");
		assertThat(scratchFiles()).isEmpty();
		verify(blobStore).upload(any(Path.class), eq("ROOM-room-1-" + job.getId() + ".webm"));
	}

	@Test
	void uploadBeforeStopIsRejected() {
		RecordingJob job = start("room-1");

		assertThatThrownBy(() -> service.uploadRecording(owner, job.getId(), video("meeting.webm"), null))
				.isInstanceOf(InvalidRecordingStateException.class);
		verify(blobStore, never()).upload(any(Path.class), anyString());
	}

	@Test
	void onlyTheOwnerMayUpload() {
		RecordingJob job = startAndStop("room-1", Duration.ofMinutes(1));

		assertThatThrownBy(() -> service.uploadRecording(participant, job.getId(), video("meeting.webm"), null))
				.isInstanceOf(RecordingForbiddenException.class);
	}

	@Test
	void unsupportedFormatIsRejected() {
		RecordingJob job = startAndStop("room-1", Duration.ofMinutes(1));

		assertThatThrownBy(() -> service.uploadRecording(owner, job.getId(), video("slides.pdf"), null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void storageFailureKeepsScratchFileForRetry() {
		RecordingJob job = startAndStop("room-1", Duration.ofMinutes(1));
		when(blobStore.upload(any(Path.class), anyString()))
				.thenThrow(new StorageFailureException("bucket unavailable"));

		assertThatThrownBy(() -> service.uploadRecording(owner, job.getId(), video("meeting.webm"), null))
				.isInstanceOf(StorageFailureException.class);

		RecordingJob pending = service.get(owner, job.getId());
		assertThat(pending.getStatus()).isEqualTo(RecordingStatus.PROCESSING);
		assertThat(pending.getScratchFilePath()).isNotNull();
		assertThat(Path.of(pending.getScratchFilePath())).exists();

		doReturn("https://blobs/retried").when(blobStore).upload(any(Path.class), anyString());
		RecordingJob completed = service.retryOffload(owner, job.getId());

		assertThat(completed.getStatus()).isEqualTo(RecordingStatus.COMPLETED);
		assertThat(Path.of(pending.getScratchFilePath())).doesNotExist();
	}

	@Test
	void chunkedUploadIsAssembledAndOffloaded() {
		RecordingJob job = start("room-1");
		UploadInitResponse init = service.initChunkedUpload(owner, job.getId(), new UploadInitRequest(3, "meeting.webm", 9L));
		assertThat(init.getChunkSize()).isEqualTo(DataSize.ofMegabytes(5).toBytes());

		service.putChunk(owner, job.getId(), init.getUploadId(), 2, 3, part("ccc"));
		service.putChunk(owner, job.getId(), init.getUploadId(), 0, 3, part("aaa"));
		service.putChunk(owner, job.getId(), init.getUploadId(), 1, 3, part("bbb"));
		clock.advance(Duration.ofMinutes(1));
		service.stop(owner, job.getId(), null);

		AtomicReference<String> uploaded = new AtomicReference<>();
		when(blobStore.upload(any(Path.class), anyString())).thenAnswer(inv -> {
			uploaded.set(Files.readString(inv.getArgument(0)));
			return "https://blobs/chunked";
		});

		RecordingJob completed = service.completeChunkedUpload(owner, job.getId(),
				new UploadCompleteRequest(init.getUploadId(), "meeting.webm", List.of()));

		assertThat(uploaded.get()).isEqualTo("aaabbbccc");
		assertThat(completed.getStatus()).isEqualTo(RecordingStatus.COMPLETED);
		assertThat(completed.getFileSizeBytes()).isEqualTo(9L);
	}

	@Test
	void assembledFileIsDiscardedWhenTheJobFailsBeforeOffload() {
		InMemoryRecordingMetadataStore racingStore = new InMemoryRecordingMetadataStore() {
			@Override
			public synchronized RecordingJob update(String id, RecordingJobPatch patch) {
				if (patch.getScratchFilePath() != null) {
					super.update(id, RecordingJobPatch.builder()
							.status(RecordingStatus.FAILED)
							.errorDetail("Cleanup requested by user")
							.build());
				}
				return super.update(id, patch);
			}
		};
		service = serviceWith(racingStore);
		RecordingJob job = start("room-1");
		UploadInitResponse init = service.initChunkedUpload(owner, job.getId(), new UploadInitRequest(1, "meeting.webm", null));
		service.putChunk(owner, job.getId(), init.getUploadId(), 0, 1, part("aaa"));
		service.stop(owner, job.getId(), null);

		assertThatThrownBy(() -> service.completeChunkedUpload(owner, job.getId(),
				new UploadCompleteRequest(init.getUploadId(), "meeting.webm", null)))
				.isInstanceOf(InvalidRecordingStateException.class);

		assertThat(scratchFiles()).isEmpty();
		verify(blobStore, never()).upload(any(Path.class), anyString());
	}

	@Test
	void incompleteChunkedUploadLeavesJobProcessing() {
		RecordingJob job = start("room-1");
		UploadInitResponse init = service.initChunkedUpload(owner, job.getId(), new UploadInitRequest(2, "meeting.webm", null));
		service.putChunk(owner, job.getId(), init.getUploadId(), 0, 2, part("aaa"));
		service.stop(owner, job.getId(), null);

		assertThatThrownBy(() -> service.completeChunkedUpload(owner, job.getId(),
				new UploadCompleteRequest(init.getUploadId(), null, null)))
				.isInstanceOf(IncompleteUploadException.class);

		assertThat(service.get(owner, job.getId()).getStatus()).isEqualTo(RecordingStatus.PROCESSING);
		verify(blobStore, never()).upload(any(Path.class), anyString());
	}

	@Test
	void failingAJobDiscardsItsUploadSessions() {
		RecordingJob job = start("room-1");
		UploadInitResponse init = service.initChunkedUpload(owner, job.getId(), new UploadInitRequest(2, null, null));
		service.putChunk(owner, job.getId(), init.getUploadId(), 0, 2, part("aaa"));

		RecordingJob failed = service.fail(owner, job.getId(), "encoder crashed");

		assertThat(failed.getStatus()).isEqualTo(RecordingStatus.FAILED);
		assertThat(failed.getErrorDetail()).isEqualTo("encoder crashed");
		assertThat(failed.getEndTime()).isEqualTo(T0);
		assertThat(assembler.session(init.getUploadId())).isEmpty();
		assertThatThrownBy(() -> service.fail(owner, job.getId(), "again"))
				.isInstanceOf(InvalidRecordingStateException.class);
	}

	@Test
	void cleanupFailsTheActiveJobOfARoom() {
		RecordingJob job = start("room-1");

		RecordingJob cleaned = service.cleanupRoom("room-1");

		assertThat(cleaned.getId()).isEqualTo(job.getId());
		assertThat(cleaned.getStatus()).isEqualTo(RecordingStatus.FAILED);
		assertThat(cleaned.getErrorDetail()).isEqualTo("Cleanup requested by user");
		assertThatThrownBy(() -> service.cleanupRoom("room-1")).isInstanceOf(RecordingNotFoundException.class);
		assertThat(start("room-1").getStatus()).isEqualTo(RecordingStatus.RECORDING);
	}

	@Test
	void completedJobStaysCompleted() {
		RecordingJob completed = completedRecording("room-1");

		assertThat(service.markFailed(completed.getId(), "late failure").getStatus()).isEqualTo(RecordingStatus.COMPLETED);
		assertThatThrownBy(() -> service.fail(owner, completed.getId(), "late failure"))
				.isInstanceOf(InvalidRecordingStateException.class);
	}

	@Test
	void downloadIsLimitedToOwnerAndParticipants() {
		RecordingJob completed = completedRecording("room-1");
		when(blobStore.signedDownloadUrl(completed.getStorageLocator(), Duration.ofHours(1))).thenReturn("https://signed");

		DownloadUrlResponse response = service.downloadUrl(participant, completed.getId());

		assertThat(response.getDownloadUrl()).isEqualTo("https://signed");
		assertThat(response.getExpiresIn()).isEqualTo(3600L);
		assertThat(service.downloadUrl(owner, completed.getId()).getDownloadUrl()).isEqualTo("https://signed");
		assertThatThrownBy(() -> service.downloadUrl(stranger, completed.getId()))
				.isInstanceOf(RecordingForbiddenException.class);
	}

	@Test
	void downloadBeforeOffloadIsNotFound() {
		RecordingJob job = start("room-1");

		assertThatThrownBy(() -> service.downloadUrl(owner, job.getId()))
				.isInstanceOf(RecordingNotFoundException.class);
	}

	@Test
	void onlyTheOwnerMayDelete() {
		RecordingJob completed = completedRecording("room-1");

		assertThatThrownBy(() -> service.delete(participant, completed.getId()))
				.isInstanceOf(RecordingForbiddenException.class);

		service.delete(owner, completed.getId());

		verify(blobStore).delete(completed.getStorageLocator());
		assertThat(store.size()).isZero();
	}

	@Test
	void deleteRemovesMetadataEvenWhenBlobDeleteFails() {
		RecordingJob completed = completedRecording("room-1");
		when(blobStore.delete(anyString())).thenThrow(new StorageFailureException("unreachable"));

		service.delete(owner, completed.getId());

		assertThat(store.get(completed.getId())).isEmpty();
	}

	@Test
	void listingsOnlyShowReadableRecordings() {
		RecordingJob mine = start("room-1");
		RecordingJob notMine = service.start(stranger, new StartRecordingRequest("room-2", "ROOM-room-2", "Other", null));

		assertThat(service.listVisible(participant)).extracting(RecordingJob::getId).containsExactly(mine.getId());
		assertThat(service.listRoom(participant, "room-2")).isEmpty();
		assertThat(service.listRoom(stranger, "room-2")).extracting(RecordingJob::getId).containsExactly(notMine.getId());
		assertThatThrownBy(() -> service.get(stranger, mine.getId())).isInstanceOf(RecordingForbiddenException.class);
		assertThatThrownBy(() -> service.get(owner, "missing")).isInstanceOf(RecordingNotFoundException.class);
	}

	private RecordingLifecycleService serviceWith(RecordingMetadataStore metadataStore) {
		RecordingPolicyConfig policy = new RecordingPolicyConfig(Duration.ofDays(3), Duration.ofMinutes(5),
				Duration.ofHours(1));
		return new RecordingLifecycleService(metadataStore, blobStore, assembler, scratchStorage,
				new ValidationService(), policy, clock, DataSize.ofMegabytes(5), 10000, DataSize.ofMegabytes(10));
	}

	private RecordingJob start(String roomId) {
		return service.start(owner, new StartRecordingRequest(roomId, "ROOM-" + roomId, "Standup",
				List.of(participant.id())));
	}

	private RecordingJob startAndStop(String roomId, Duration length) {
		RecordingJob job = start(roomId);
		clock.advance(length);
		return service.stop(owner, job.getId(), null);
	}

	private RecordingJob completedRecording(String roomId) {
		RecordingJob job = startAndStop(roomId, Duration.ofMinutes(1));
		when(blobStore.upload(any(Path.class), anyString())).thenReturn("https://blobs/" + roomId);
		return service.uploadRecording(owner, job.getId(), video("meeting.webm"), null);
	}

	private static MockMultipartFile video(String fileName) {
		return new MockMultipartFile("video", fileName, "video/webm", "video-bytes".getBytes(StandardCharsets.UTF_8));
	}

	private static MockMultipartFile part(String content) {
		return new MockMultipartFile("chunk", "blob", "application/octet-stream", content.getBytes(StandardCharsets.UTF_8));
	}

	private List<Path> scratchFiles() {
		try (Stream<Path> files = Files.list(scratchStorage.getBaseDir())) {
			return files.toList();
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
	}
}
