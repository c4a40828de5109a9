package com.vidrecorder.sweep;

import com.vidrecorder.model.RecordingJob;
import com.vidrecorder.model.SweepReport;
import com.vidrecorder.service.RecordingMetadataStore;
import com.vidrecorder.storage.BlobStoreService;
import com.vidrecorder.upload.ChunkedUploadAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deletes completed recordings whose retention deadline has passed, from the blob store and then
 * from the metadata store.
 * <p>
 * A blob delete that fails or exceeds the per-object timeout is counted and skipped; the metadata
 * record is deleted either way. A timed-out delete is cancelled with an interrupt so its thread is
 * handed back to the pool. Runs never overlap: a run requested while another is in progress
 * returns a skipped report.
 */
@Service
@Slf4j
public class RetentionSweepService {

    private final RecordingMetadataStore store;
    private final BlobStoreService blobStore;
    private final ChunkedUploadAssembler assembler;
    private final AsyncTaskExecutor blobDeleteExecutor;
    private final Clock clock;
    private final Duration deleteTimeout;
    private final Duration sessionTtl;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RetentionSweepService(RecordingMetadataStore store,
                                 BlobStoreService blobStore,
                                 ChunkedUploadAssembler assembler,
                                 @Qualifier("blobDeleteExecutor") AsyncTaskExecutor blobDeleteExecutor,
                                 Clock clock,
                                 @Value("${recording.retention.delete-timeout:30s}") Duration deleteTimeout,
                                 @Value("${recording.upload.session-ttl:24h}") Duration sessionTtl) {
        this.store = store;
        this.blobStore = blobStore;
        this.assembler = assembler;
        this.blobDeleteExecutor = blobDeleteExecutor;
        this.clock = clock;
        this.deleteTimeout = deleteTimeout;
        this.sessionTtl = sessionTtl;
    }

    public SweepReport sweep() {
        Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.info("Retention sweep already in progress, skipping run requested at {}", startedAt);
            return SweepReport.skipped(startedAt);
        }
        try {
            return doSweep(startedAt);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private SweepReport doSweep(Instant startedAt) {
        SweepReport report = new SweepReport();
        report.setStartedAt(startedAt);

        List<RecordingJob> expired;
        try {
            expired = store.listExpired(startedAt);
        } catch (RuntimeException e) {
            log.error("Retention sweep could not list expired recordings", e);
            report.setReapedUploadSessions(reapSessions());
            return report;
        }
        report.setExpired(expired.size());

        for (RecordingJob job : expired) {
            if (job.getStorageLocator() != null && !deleteBlob(job)) {
                report.setBlobDeleteFailures(report.getBlobDeleteFailures() + 1);
            }
            try {
                store.delete(job.getId());
                report.setDeleted(report.getDeleted() + 1);
                log.debug("Deleted expired recording {} (deadline {})", job.getId(), job.getRetentionDeadline());
            } catch (RuntimeException e) {
                report.setFailed(report.getFailed() + 1);
                log.error("Failed to delete metadata of expired recording {}", job.getId(), e);
            }
        }

        report.setReapedUploadSessions(reapSessions());
        log.info("Retention sweep finished: {} expired, {} deleted, {} failed, {} blob delete failures, {} upload sessions reaped",
                report.getExpired(), report.getDeleted(), report.getFailed(),
                report.getBlobDeleteFailures(), report.getReapedUploadSessions());
        return report;
    }

    private boolean deleteBlob(RecordingJob job) {
        String objectName = job.getStorageLocator();
        Future<Boolean> delete;
        try {
            delete = blobDeleteExecutor.submit(() -> blobStore.delete(objectName));
        } catch (RejectedExecutionException e) {
            log.warn("No blob delete thread available, skipping blob {} of recording {}", objectName, job.getId());
            return false;
        }

        try {
            delete.get(deleteTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            delete.cancel(true);
            log.warn("Deleting blob {} of recording {} timed out after {}", objectName, job.getId(), deleteTimeout);
            return false;
        } catch (ExecutionException e) {
            log.error("Failed to delete blob {} of recording {}", objectName, job.getId(), e.getCause());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while deleting blob {} of recording {}", objectName, job.getId());
            return false;
        }
    }

    private int reapSessions() {
        try {
            return assembler.reapAbandoned(sessionTtl);
        } catch (RuntimeException e) {
            log.error("Failed to reap abandoned upload sessions", e);
            return 0;
        }
    }
}
