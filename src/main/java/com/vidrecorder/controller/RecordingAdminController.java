package com.vidrecorder.controller;

import com.vidrecorder.model.SweepReport;
import com.vidrecorder.storage.BlobStoreService;
import com.vidrecorder.sweep.RetentionSweepService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Operator endpoints: manual retention sweep and blob store configuration.
 */
@RestController
@RequestMapping("/api/recordings")
@PreAuthorize("hasAnyRole('OPERATOR', 'ADMIN')")
@Slf4j
public class RecordingAdminController {

    @Autowired
    private RetentionSweepService sweepService;

    @Autowired
    private BlobStoreService blobStoreService;

    @PostMapping("/cleanup-old")
    public ResponseEntity<SweepReport> cleanupOld() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        log.info("Manual retention sweep requested by {}", auth.getName());
        return ResponseEntity.ok(sweepService.sweep());
    }

    @GetMapping("/config/status")
    public ResponseEntity<Map<String, Object>> configStatus() {
        boolean configured = blobStoreService.isConfigured();
        Map<String, Object> status = new HashMap<>();
        status.put("backend", blobStoreService.backendName());
        status.put("configured", configured);
        status.put("message", configured
                ? "Blob storage is properly configured"
                : "Blob storage configuration is missing. Please check environment variables.");
        return ResponseEntity.ok(status);
    }

    @PostMapping("/config/initialize")
    public ResponseEntity<Map<String, Object>> initialize() {
        blobStoreService.initialize();
        log.info("Blob store {} initialized", blobStoreService.backendName());

        Map<String, Object> result = new HashMap<>();
        result.put("status", "initialized");
        result.put("backend", blobStoreService.backendName());
        result.put("message", "Blob storage initialized successfully");
        return ResponseEntity.ok(result);
    }
}
