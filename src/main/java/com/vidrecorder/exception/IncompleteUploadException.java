package com.vidrecorder.exception;

import lombok.Getter;

import java.util.List;

/**
 * Assembly was requested before every declared chunk arrived. Nothing is written to the final path;
 * the received chunks stay so the caller can resend only the missing indices.
 */
@Getter
public class IncompleteUploadException extends RecordingException {

    private final String uploadId;
    private final List<Integer> missingChunks;

    public IncompleteUploadException(String uploadId, List<Integer> missingChunks) {
        super("Upload " + uploadId + " is missing " + missingChunks.size() + " chunk(s): " + summarize(missingChunks));
        this.uploadId = uploadId;
        this.missingChunks = List.copyOf(missingChunks);
    }

    private static String summarize(List<Integer> missing) {
        if (missing.size() <= 20) {
            return missing.toString();
        }
        return missing.subList(0, 20) + "...";
    }
}
