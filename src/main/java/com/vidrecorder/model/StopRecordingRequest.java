package com.vidrecorder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StopRecordingRequest {
    private Long duration; // seconds, client-reported
}
