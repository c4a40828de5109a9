package com.vidrecorder.controller;

import com.vidrecorder.model.RecordingView;
import com.vidrecorder.security.CurrentUserService;
import com.vidrecorder.security.RecordingUser;
import com.vidrecorder.service.RecordingLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
public class RoomRecordingsController {

    private final RecordingLifecycleService lifecycleService;
    private final CurrentUserService currentUserService;

    /**
     * Recordings of one room that the caller owns or took part in, newest first
     */
    @GetMapping("/{roomId}/recordings")
    public ResponseEntity<List<RecordingView>> listRoomRecordings(@PathVariable String roomId) {
        RecordingUser user = currentUserService.requireCurrentUser();
        return ResponseEntity.ok(lifecycleService.listRoom(user, roomId).stream()
                .map(RecordingView::from)
                .toList());
    }
}
