package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.config.FeedProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the purge cycle and the retention sweep on independent fixed delays.
 */
@Service
public class FeedMaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(FeedMaintenanceScheduler.class);

    private final JobPurgeService purgeService;
    private final JobRetentionService retentionService;
    private final FeedProperties properties;
    private final ScheduledExecutorService executor;
    private final Object lifecycleLock = new Object();
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public FeedMaintenanceScheduler(
        JobPurgeService purgeService,
        JobRetentionService retentionService,
        FeedProperties properties,
        @Qualifier("maintenanceExecutor") ScheduledExecutorService executor
    ) {
        this.purgeService = purgeService;
        this.retentionService = retentionService;
        this.properties = properties;
        this.executor = executor;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getSchedule().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return !tasks.isEmpty();
        }
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (!tasks.isEmpty()) {
                return;
            }
            FeedProperties.Schedule schedule = properties.getSchedule();
            long initialDelay = schedule.getInitialDelaySeconds();
            tasks.add(executor.scheduleWithFixedDelay(
                this::runPurge,
                initialDelay,
                schedule.getPurgeIntervalMinutes() * 60L,
                TimeUnit.SECONDS
            ));
            tasks.add(executor.scheduleWithFixedDelay(
                this::runRetention,
                initialDelay,
                schedule.getRetentionIntervalMinutes() * 60L,
                TimeUnit.SECONDS
            ));
            log.info(
                "Maintenance scheduled: purge every {}m, retention every {}m",
                schedule.getPurgeIntervalMinutes(),
                schedule.getRetentionIntervalMinutes()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            for (ScheduledFuture<?> task : tasks) {
                task.cancel(false);
            }
            tasks.clear();
        }
    }

    void runPurge() {
        try {
            purgeService.purge();
        } catch (Exception e) {
            log.warn("Scheduled purge cycle failed", e);
        }
    }

    void runRetention() {
        try {
            retentionService.purgeExpired();
        } catch (Exception e) {
            log.warn("Scheduled retention sweep failed", e);
        }
    }
}
