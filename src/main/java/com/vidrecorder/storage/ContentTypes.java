package com.vidrecorder.storage;

import org.apache.commons.io.FilenameUtils;

import java.util.Map;

/**
 * Content type lookup by file extension for stored recordings.
 */
public final class ContentTypes {

    public static final String DEFAULT = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.of(
            "webm", "video/webm",
            "mp4", "video/mp4",
            "mkv", "video/x-matroska",
            "avi", "video/x-msvideo",
            "mov", "video/quicktime"
    );

    private ContentTypes() {
    }

    public static String forFileName(String fileName) {
        if (fileName == null) {
            return DEFAULT;
        }
        String extension = FilenameUtils.getExtension(fileName).toLowerCase();
        return BY_EXTENSION.getOrDefault(extension, DEFAULT);
    }
}
