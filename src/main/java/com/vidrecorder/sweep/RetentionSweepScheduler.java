package com.vidrecorder.sweep;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the recurring retention sweep: the first run fires at startup, then one per
 * {@code recording.retention.sweep-interval}. Started and stopped with the application context.
 */
@Component
@Slf4j
public class RetentionSweepScheduler implements SmartLifecycle {

    private final RetentionSweepService sweepService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration interval;
    private final boolean enabled;

    private volatile ScheduledFuture<?> scheduled;

    public RetentionSweepScheduler(RetentionSweepService sweepService,
                                   @Qualifier("retentionTaskScheduler") TaskScheduler taskScheduler,
                                   Clock clock,
                                   @Value("${recording.retention.sweep-interval:1h}") Duration interval,
                                   @Value("${recording.retention.sweep-enabled:true}") boolean enabled) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("recording.retention.sweep-interval must be positive");
        }
        this.sweepService = sweepService;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.interval = interval;
        this.enabled = enabled;
    }

    @Override
    public synchronized void start() {
        if (!enabled) {
            log.info("Retention sweep disabled");
            return;
        }
        if (scheduled != null) {
            return;
        }
        scheduled = taskScheduler.scheduleAtFixedRate(this::runSweep, clock.instant(), interval);
        log.info("Retention sweep scheduled every {}", interval);
    }

    @Override
    public synchronized void stop() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
            log.info("Retention sweep stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return scheduled != null;
    }

    private void runSweep() {
        try {
            sweepService.sweep();
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every later run
            log.error("Retention sweep run failed", e);
        }
    }
}
