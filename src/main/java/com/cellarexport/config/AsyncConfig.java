package com.cellarexport.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    /**
     * Runs export mailboxes. A job occupies at most one thread at a time.
     */
    @Bean(name = "exportJobExecutor")
    public ThreadPoolTaskExecutor exportJobExecutor(@Value("${export.executor.job-threads:4}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("export-job-");
        executor.initialize();
        return executor;
    }

    /**
     * Fan-out for existence probes against R2.
     */
    @Bean(name = "blobProbeExecutor")
    public ThreadPoolTaskExecutor blobProbeExecutor(@Value("${export.probe.batch-size:10}") int batchSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchSize);
        executor.setMaxPoolSize(batchSize);
        executor.setThreadNamePrefix("blob-probe-");
        executor.initialize();
        return executor;
    }

    /**
     * Producer side of the archive pipe: writes ZIP entries while the uploader drains them.
     */
    @Bean(name = "archiveWriterExecutor")
    public Executor archiveWriterExecutor(@Value("${export.executor.job-threads:4}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("archive-writer-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "exportAlarmScheduler")
    public TaskScheduler exportAlarmScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("export-alarm-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
