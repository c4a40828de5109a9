package com.vidrecorder.upload;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Local disk holding recordings that have not been offloaded to the blob store yet.
 */
@Service
@Slf4j
public class ScratchStorageService {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path baseDir;

    public ScratchStorageService(@Value("${recording.scratch.dir:./recordings}") String baseDir) throws IOException {
        this.baseDir = Path.of(baseDir).toAbsolutePath().normalize();
        Files.createDirectories(this.baseDir);
    }

    /**
     * A fresh, not yet existing path for a recording file.
     */
    public Path newRecordingPath(String recordingId, String extension) {
        String ts = LocalDateTime.now().format(TS);
        return baseDir.resolve("recording-" + recordingId + "-" + ts + "-" + System.nanoTime() + "." + extension);
    }

    public Path saveRecording(String recordingId, MultipartFile file, String extension) throws IOException {
        Path out = newRecordingPath(recordingId, extension);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            discard(out.toString());
            throw e;
        }
        log.debug("Saved {} bytes for recording {} to {}", file.getSize(), recordingId, out);
        return out;
    }

    /**
     * Removes a scratch file; failures are logged, never thrown.
     */
    public void discard(String path) {
        if (path == null || path.isBlank()) {
            return;
        }
        Path file = Path.of(path).toAbsolutePath().normalize();
        if (!file.startsWith(baseDir)) {
            log.warn("Refusing to delete file outside scratch dir: {}", file);
            return;
        }
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Discarded scratch file {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to discard scratch file {}", file, e);
        }
    }

    public Path getBaseDir() {
        return baseDir;
    }
}
