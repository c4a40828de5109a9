package com.vidrecorder.upload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidrecorder.exception.IncompleteUploadException;
import com.vidrecorder.exception.StorageFailureException;
import com.vidrecorder.exception.UploadNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reassembles a recording uploaded as numbered chunks.
 * <p>
 * Each upload owns a directory under the chunk root holding {@code upload.json} and one
 * {@code chunk-<index>} file per received chunk. Chunks for different indices may be written
 * concurrently; {@link #complete} must only be called once every chunk upload has been acknowledged.
 * Completion claims the directory by renaming it, so a second completion of the same upload fails
 * with {@link UploadNotFoundException} instead of reading a half-deleted session.
 */
@Service
@Slf4j
public class ChunkedUploadAssembler {

    static final String MANIFEST_FILE = "upload.json";
    static final String CHUNK_PREFIX = "chunk-";
    private static final String CLAIMED_SUFFIX = ".assembling";
    private static final Pattern CHUNK_NAME = Pattern.compile("^chunk-(\\d+)$");

    private final Path chunkRoot;
    private final ScratchStorageService scratchStorage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChunkedUploadAssembler(@Value("${recording.scratch.chunk-dir:./uploads/chunks}") String chunkDir,
                                  ScratchStorageService scratchStorage,
                                  ObjectMapper objectMapper,
                                  Clock clock) throws IOException {
        this.chunkRoot = Path.of(chunkDir).toAbsolutePath().normalize();
        this.scratchStorage = scratchStorage;
        this.objectMapper = objectMapper;
        this.clock = clock;
        Files.createDirectories(this.chunkRoot);
    }

    /**
     * Opens an upload session for {@code totalChunks} chunks and returns its id.
     */
    public String initUpload(String recordingId, int totalChunks, String fileName, Long fileSize) {
        if (totalChunks < 1) {
            throw new IllegalArgumentException("totalChunks must be at least 1");
        }
        String uploadId = UUID.randomUUID().toString();
        UploadSession session = new UploadSession(uploadId, recordingId, totalChunks, fileName, fileSize, clock.millis());
        try {
            Files.createDirectories(sessionDir(uploadId));
            writeManifest(session);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to create upload session", e);
        }
        log.info("Initialized upload {} for recording {} ({} chunks)", uploadId, recordingId, totalChunks);
        return uploadId;
    }

    /**
     * Stores one chunk, replacing any earlier content for the same index. When the session does not
     * exist yet and {@code totalChunks} is given, it is created on the fly.
     */
    public void putChunk(String recordingId, String uploadId, int index, Integer totalChunks, InputStream data) {
        UploadSession session = readSession(uploadId)
                .or(() -> createImplicitSession(recordingId, uploadId, totalChunks))
                .orElseThrow(() -> new UploadNotFoundException(uploadId));
        if (!session.getRecordingId().equals(recordingId)) {
            throw new UploadNotFoundException(uploadId);
        }
        if (totalChunks != null && totalChunks != session.getTotalChunks()) {
            throw new IllegalArgumentException("totalChunks " + totalChunks
                    + " does not match the " + session.getTotalChunks() + " declared for upload " + uploadId);
        }
        if (index < 0 || index >= session.getTotalChunks()) {
            throw new IllegalArgumentException("chunkIndex " + index + " is outside 0.." + (session.getTotalChunks() - 1));
        }

        Path dir = sessionDir(uploadId);
        Path target = dir.resolve(CHUNK_PREFIX + index);
        Path temp = dir.resolve("." + CHUNK_PREFIX + index + "-" + UUID.randomUUID() + ".tmp");
        try {
            Files.copy(data, temp);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            deleteQuietly(temp);
            throw new UploadNotFoundException(uploadId);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageFailureException("Failed to store chunk " + index + " of upload " + uploadId, e);
        }
        log.debug("Stored chunk {}/{} of upload {}", index + 1, session.getTotalChunks(), uploadId);
    }

    /**
     * Concatenates chunks {@code 0..N-1} in numeric order into a new scratch file, removes the
     * session, and returns the assembled file.
     *
     * @throws IncompleteUploadException if any chunk is missing; no output file is left behind and
     *                                   the received chunks are kept so only the missing ones need to
     *                                   be resent. A session that is never completed is removed by
     *                                   {@link #reapAbandoned(Duration)} or when its job fails.
     * @throws UploadNotFoundException   if the session does not exist or was already completed
     */
    public Path complete(String recordingId, String uploadId, String fileName) {
        UploadSession session = readSession(uploadId)
                .filter(s -> s.getRecordingId().equals(recordingId))
                .orElseThrow(() -> new UploadNotFoundException(uploadId));

        Path dir = sessionDir(uploadId);
        Path claimed = chunkRoot.resolve(uploadId + CLAIMED_SUFFIX);
        try {
            Files.move(dir, claimed, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            // Someone else completed or discarded it first
            throw new UploadNotFoundException(uploadId);
        }
        touch(claimed);

        Map<Integer, Path> chunks;
        try {
            chunks = listChunks(claimed);
        } catch (IOException e) {
            release(claimed, dir);
            throw new StorageFailureException("Failed to read chunks of upload " + uploadId, e);
        }
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < session.getTotalChunks(); i++) {
            if (!chunks.containsKey(i)) {
                missing.add(i);
            }
        }
        if (!missing.isEmpty()) {
            release(claimed, dir);
            throw new IncompleteUploadException(uploadId, missing);
        }

        String name = fileName != null ? fileName : session.getFileName();
        String extension = name == null || FilenameUtils.getExtension(name).isEmpty()
                ? "webm" : FilenameUtils.getExtension(name).toLowerCase();
        Path finalPath = scratchStorage.newRecordingPath(recordingId, extension);
        Path partial = finalPath.resolveSibling(finalPath.getFileName() + ".part");

        long written = 0;
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(partial))) {
            for (int i = 0; i < session.getTotalChunks(); i++) {
                try (InputStream in = Files.newInputStream(chunks.get(i))) {
                    written += IOUtils.copyLarge(in, out);
                }
            }
        } catch (IOException e) {
            deleteQuietly(partial);
            release(claimed, dir);
            throw new StorageFailureException("Failed to assemble upload " + uploadId, e);
        }

        try {
            Files.move(partial, finalPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(partial);
            release(claimed, dir);
            throw new StorageFailureException("Failed to finalize upload " + uploadId, e);
        }

        if (session.getFileSize() != null && session.getFileSize() != written) {
            log.warn("Upload {} declared {} bytes but assembled {}", uploadId, session.getFileSize(), written);
        }
        deleteDirectoryQuietly(claimed);
        log.info("Assembled upload {} ({} chunks, {} bytes) into {}", uploadId, chunks.size(), written, finalPath);
        return finalPath;
    }

    /**
     * Drops an upload session and its chunks.
     *
     * @return false if there was nothing to drop
     */
    public boolean discard(String uploadId) {
        Path dir = sessionDir(uploadId);
        if (!Files.isDirectory(dir)) {
            return false;
        }
        deleteDirectoryQuietly(dir);
        return true;
    }

    /**
     * Drops every pending upload session that belongs to the recording.
     */
    public int discardSessionsFor(String recordingId) {
        int discarded = 0;
        for (Path dir : sessionDirs()) {
            Optional<UploadSession> session = readManifest(dir);
            if (session.isPresent() && recordingId.equals(session.get().getRecordingId())) {
                deleteDirectoryQuietly(dir);
                discarded++;
            }
        }
        if (discarded > 0) {
            log.info("Discarded {} upload session(s) of recording {}", discarded, recordingId);
        }
        return discarded;
    }

    /**
     * Removes sessions, including interrupted assemblies, that are older than {@code maxAge}.
     */
    public int reapAbandoned(Duration maxAge) {
        long cutoff = clock.millis() - maxAge.toMillis();
        int reaped = 0;
        for (Path dir : sessionDirs()) {
            // Claimed directories are dated by their claim, not by the session start
            long created = dir.getFileName().toString().endsWith(CLAIMED_SUFFIX)
                    ? lastModified(dir)
                    : readManifest(dir).map(UploadSession::getCreatedAtMillis).orElseGet(() -> lastModified(dir));
            if (created < cutoff) {
                deleteDirectoryQuietly(dir);
                reaped++;
            }
        }
        if (reaped > 0) {
            log.info("Reaped {} abandoned upload session(s)", reaped);
        }
        return reaped;
    }

    public Optional<UploadSession> session(String uploadId) {
        return readSession(uploadId);
    }

    private Optional<UploadSession> createImplicitSession(String recordingId, String uploadId, Integer totalChunks) {
        if (totalChunks == null) {
            return Optional.empty();
        }
        if (totalChunks < 1) {
            throw new IllegalArgumentException("totalChunks must be at least 1");
        }
        UploadSession session = new UploadSession(uploadId, recordingId, totalChunks, null, null, clock.millis());
        try {
            Files.createDirectories(sessionDir(uploadId));
            writeManifest(session);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to create upload session " + uploadId, e);
        }
        log.info("Created upload {} for recording {} on first chunk ({} chunks)", uploadId, recordingId, totalChunks);
        // A concurrent first chunk may have written its own manifest
        return readSession(uploadId);
    }

    private Optional<UploadSession> readSession(String uploadId) {
        return readManifest(sessionDir(uploadId));
    }

    private Optional<UploadSession> readManifest(Path dir) {
        Path manifest = dir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(manifest.toFile(), UploadSession.class));
        } catch (IOException e) {
            log.warn("Unreadable upload manifest {}: {}", manifest, e.toString());
            return Optional.empty();
        }
    }

    private void writeManifest(UploadSession session) throws IOException {
        Path dir = sessionDir(session.getUploadId());
        Path temp = dir.resolve("." + MANIFEST_FILE + "-" + UUID.randomUUID() + ".tmp");
        objectMapper.writeValue(temp.toFile(), session);
        Files.move(temp, dir.resolve(MANIFEST_FILE), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Map<Integer, Path> listChunks(Path dir) throws IOException {
        // Numeric order: chunk-2 before chunk-10
        Map<Integer, Path> chunks = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, CHUNK_PREFIX + "*")) {
            for (Path file : stream) {
                Matcher matcher = CHUNK_NAME.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    chunks.put(Integer.parseInt(matcher.group(1)), file);
                }
            }
        }
        return chunks;
    }

    private List<Path> sessionDirs() {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(chunkRoot, Files::isDirectory)) {
            stream.forEach(dirs::add);
        } catch (IOException e) {
            log.warn("Failed to list upload sessions under {}", chunkRoot, e);
        }
        return dirs;
    }

    private Path sessionDir(String uploadId) {
        try {
            UUID.fromString(uploadId);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid upload id");
        }
        return chunkRoot.resolve(uploadId);
    }

    private void release(Path claimed, Path dir) {
        try {
            Files.move(claimed, dir, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Could not release upload session {}; chunks remain in {}", dir.getFileName(), claimed, e);
        }
    }

    private void touch(Path dir) {
        try {
            Files.setLastModifiedTime(dir, FileTime.fromMillis(clock.millis()));
        } catch (IOException e) {
            log.debug("Could not touch {}", dir, e);
        }
    }

    private static long lastModified(Path dir) {
        try {
            return Files.getLastModifiedTime(dir).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private static void deleteDirectoryQuietly(Path dir) {
        try {
            FileUtils.deleteDirectory(dir.toFile());
        } catch (IOException e) {
            log.warn("Error cleaning up upload directory {}", dir, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove {}", file, e);
        }
    }
}
