package com.vidrecorder.upload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manifest stored next to the chunks of one upload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadSession {
    private String uploadId;
    private String recordingId;
    private int totalChunks;
    private String fileName;
    private Long fileSize;
    private long createdAtMillis;
}
