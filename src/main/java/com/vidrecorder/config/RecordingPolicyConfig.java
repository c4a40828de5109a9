package com.vidrecorder.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Timing policy for the recording lifecycle.
 */
@Configuration
@Getter
@Slf4j
public class RecordingPolicyConfig {

    private final Duration retentionWindow;
    private final Duration livenessTimeout;
    private final Duration downloadUrlTtl;

    public RecordingPolicyConfig(
            @Value("${recording.retention-window:3d}") Duration retentionWindow,
            @Value("${recording.liveness-timeout:5m}") Duration livenessTimeout,
            @Value("${recording.download-url-ttl:1h}") Duration downloadUrlTtl) {
        if (retentionWindow.isNegative() || livenessTimeout.isNegative() || downloadUrlTtl.isNegative()) {
            throw new IllegalStateException("Recording policy durations must not be negative");
        }
        this.retentionWindow = retentionWindow;
        this.livenessTimeout = livenessTimeout;
        this.downloadUrlTtl = downloadUrlTtl;
        log.info("Recording policy: retention={}, liveness timeout={}, download URL ttl={}",
                retentionWindow, livenessTimeout, downloadUrlTtl);
    }
}
