package com.vidrecorder.service;

import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.regex.Pattern;

@Service
public class ValidationService {

    private static final Pattern UPLOAD_ID_PATTERN = Pattern.compile("^[a-fA-F0-9\\-]{36}$");

    private static final Pattern FILE_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-\\.@ ()\\[\\]+,]+$");

    // Recording formats accepted from clients
    private static final Set<String> SUPPORTED_RECORDING_FORMATS = Set.of("webm", "mp4", "mkv");

    /**
     * Upload ids name scratch directories, so only the UUID alphabet is allowed
     */
    public void validateUploadId(String uploadId) {
        if (uploadId == null || !UPLOAD_ID_PATTERN.matcher(uploadId).matches()) {
            throw new IllegalArgumentException("Invalid upload id");
        }
    }

    public void validateRoomFields(String roomId, String roomCode, String roomName) {
        if (isBlank(roomId) || isBlank(roomCode) || isBlank(roomName)) {
            throw new IllegalArgumentException("Missing required fields: roomId, roomCode, roomName");
        }
        if (roomCode.length() > 128 || roomId.length() > 255 || roomName.length() > 255) {
            throw new IllegalArgumentException("Room identity fields exceed maximum length");
        }
    }

    /**
     * Validates a client-supplied recording file name and returns its lower-cased extension
     */
    public String validateRecordingFileName(String fileName) {
        if (isBlank(fileName)) {
            throw new IllegalArgumentException("File name cannot be null or empty");
        }
        String baseName = FilenameUtils.getName(fileName);
        if (baseName.contains("..") || !FILE_NAME_PATTERN.matcher(baseName).matches()) {
            throw new IllegalArgumentException("File name contains invalid characters");
        }
        if (baseName.length() > 255) {
            throw new IllegalArgumentException("File name exceeds maximum length");
        }
        String extension = FilenameUtils.getExtension(baseName).toLowerCase();
        if (!SUPPORTED_RECORDING_FORMATS.contains(extension)) {
            throw new IllegalArgumentException("Only video files are allowed (webm, mp4, mkv)");
        }
        return extension;
    }

    public void validateChunk(int chunkIndex, int totalChunks, int maxChunks) {
        if (totalChunks < 1 || totalChunks > maxChunks) {
            throw new IllegalArgumentException("totalChunks must be between 1 and " + maxChunks);
        }
        if (chunkIndex < 0 || chunkIndex >= totalChunks) {
            throw new IllegalArgumentException("chunkIndex " + chunkIndex + " is outside 0.." + (totalChunks - 1));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
