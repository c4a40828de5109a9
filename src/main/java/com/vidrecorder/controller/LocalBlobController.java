package com.vidrecorder.controller;

import com.vidrecorder.storage.ContentTypes;
import com.vidrecorder.storage.LocalBlobStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Serves objects of the filesystem blob store through signed, expiring URLs.
 */
@RestController
@RequestMapping("/api/blobs")
@ConditionalOnProperty(name = "recording.storage.backend", havingValue = "local")
@RequiredArgsConstructor
@Slf4j
public class LocalBlobController {

    private final LocalBlobStoreService blobStore;

    @GetMapping("/{objectName}")
    public ResponseEntity<Resource> download(@PathVariable String objectName,
                                             @RequestParam(value = "expires", defaultValue = "0") long expires,
                                             @RequestParam(value = "signature", required = false) String signature) {
        Optional<Path> file = blobStore.openSigned(objectName, expires, signature);
        if (file.isEmpty()) {
            log.warn("Rejected blob download for {}", objectName);
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(ContentTypes.forFileName(objectName)))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + objectName + "\"")
                .body(new FileSystemResource(file.get()));
    }
}
