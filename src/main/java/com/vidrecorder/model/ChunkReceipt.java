package com.vidrecorder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChunkReceipt {
    private String uploadId;
    private int chunkIndex;
    private boolean received;
    private String message;
}
