package com.vidrecorder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs individual blob deletes for the retention sweep so each one can be time-boxed.
     * <p>
     * No queue: a delete either starts on a thread right away or is rejected, so its timeout never
     * runs down while it waits behind a hung delete.
     */
    @Bean(name = "blobDeleteExecutor")
    public ThreadPoolTaskExecutor blobDeleteExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("blob-delete-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "retentionTaskScheduler")
    public ThreadPoolTaskScheduler retentionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1); // one sweep at a time
        scheduler.setThreadNamePrefix("retention-sweep-");
        scheduler.initialize();
        return scheduler;
    }
}
