package com.vidrecorder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitRequest {
    private Integer totalChunks;
    private String fileName;
    private Long fileSize;
}
