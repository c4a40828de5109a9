package com.vidrecorder.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalBlobStoreServiceTest {

	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

	@TempDir
	Path tempDir;

	private LocalBlobStoreService blobStore;

	@BeforeEach
	void setUp() {
		blobStore = newStore(NOW);
		blobStore.initialize();
	}

	@Test
	void uploadStoresObjectAndRemovesLocalFile() throws IOException {
		Path local = Files.writeString(tempDir.resolve("scratch.webm"), "video-bytes");

		String url = blobStore.upload(local, "ROOM-abc.webm");

		assertThat(url).isEqualTo("http://localhost:8080/api/blobs/ROOM-abc.webm");
		assertThat(local).doesNotExist();
		assertThat(Files.readString(tempDir.resolve("blobs/ROOM-abc.webm"))).isEqualTo("video-bytes");
	}

	@Test
	void signedUrlOpensUntilItExpires() throws IOException {
		blobStore.upload(Files.writeString(tempDir.resolve("a.webm"), "x"), "ROOM-abc.webm");

		MultiValueMap<String, String> query = UriComponentsBuilder
				.fromUriString(blobStore.signedDownloadUrl("ROOM-abc.webm", Duration.ofHours(1)))
				.build().getQueryParams();
		long expires = Long.parseLong(query.getFirst("expires"));
		String signature = query.getFirst("signature");

		assertThat(expires).isEqualTo(NOW.plus(Duration.ofHours(1)).getEpochSecond());
		assertThat(blobStore.openSigned("ROOM-abc.webm", expires, signature)).isPresent();
		assertThat(blobStore.openSigned("ROOM-other.webm", expires, signature)).isEmpty();
		assertThat(blobStore.openSigned("ROOM-abc.webm", expires + 60, signature)).isEmpty();

		LocalBlobStoreService later = newStore(NOW.plus(Duration.ofHours(2)));
		assertThat(later.openSigned("ROOM-abc.webm", expires, signature)).isEmpty();
	}

	@Test
	void deleteIsIdempotent() throws IOException {
		blobStore.upload(Files.writeString(tempDir.resolve("a.webm"), "x"), "ROOM-abc.webm");

		assertThat(blobStore.delete("ROOM-abc.webm")).isTrue();
		assertThat(blobStore.delete("ROOM-abc.webm")).isFalse();
	}

	@Test
	void objectNamesCannotEscapeTheRoot() {
		assertThatThrownBy(() -> blobStore.delete("../outside.webm"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private LocalBlobStoreService newStore(Instant now) {
		return new LocalBlobStoreService(tempDir.resolve("blobs"), "http://localhost:8080/",
				"test-signing-key", Clock.fixed(now, ZoneOffset.UTC));
	}
}
