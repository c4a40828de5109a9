package com.vidrecorder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DownloadUrlResponse {
    private String recordingId;
    private String downloadUrl;
    private long expiresIn; // seconds
    private String message;
}
