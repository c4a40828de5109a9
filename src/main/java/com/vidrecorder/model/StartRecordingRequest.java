package com.vidrecorder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartRecordingRequest {
    private String roomId;
    private String roomCode;
    private String roomName;
    private List<String> participantIds; // optional, may also be supplied on upload
}
