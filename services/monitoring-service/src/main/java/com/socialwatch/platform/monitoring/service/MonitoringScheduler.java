package com.socialwatch.platform.monitoring.service;

import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import com.socialwatch.platform.monitoring.dto.CheckCycleSummary;
import com.socialwatch.platform.monitoring.dto.SchedulerStatusResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives {@link MonitoringService} on a fixed cadence. A tick that finds a cycle still running
 * is skipped, not queued.
 */
@Service
@Slf4j
public class MonitoringScheduler {

    private final MonitoringService monitoringService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration interval;
    private final boolean autoStart;

    private final AtomicInteger skippedTicks = new AtomicInteger();
    private ScheduledFuture<?> scheduledTask;
    private OffsetDateTime startedAt;
    private volatile OffsetDateTime lastTickAt;

    public MonitoringScheduler(MonitoringService monitoringService,
                               @Qualifier("monitoringTaskScheduler") TaskScheduler monitoringTaskScheduler,
                               MonitoringProperties properties, Clock clock) {
        this.monitoringService = monitoringService;
        this.taskScheduler = monitoringTaskScheduler;
        this.clock = clock;
        this.interval = properties.getScheduler().getInterval();
        this.autoStart = properties.getScheduler().isAutoStart();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (autoStart) {
            start();
        } else {
            log.info("Monitoring scheduler auto-start disabled");
        }
    }

    public synchronized boolean start() {
        if (isRunning()) {
            log.debug("Monitoring scheduler already running");
            return false;
        }
        scheduledTask = taskScheduler.scheduleAtFixedRate(this::tick, interval);
        startedAt = OffsetDateTime.now(clock);
        log.info("Monitoring scheduler started, interval {}", interval);
        return true;
    }

    public synchronized boolean stop() {
        if (!isRunning()) {
            return false;
        }
        scheduledTask.cancel(false);
        scheduledTask = null;
        startedAt = null;
        log.info("Monitoring scheduler stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return scheduledTask != null && !scheduledTask.isCancelled();
    }

    public synchronized SchedulerStatusResponse status() {
        CheckCycleSummary lastCycle = monitoringService.getLastCycle();
        return SchedulerStatusResponse.builder()
                .running(isRunning())
                .cycleInProgress(monitoringService.isCycleRunning())
                .intervalSeconds(interval.getSeconds())
                .startedAt(startedAt)
                .lastTickAt(lastTickAt)
                .skippedTicks(skippedTicks.get())
                .lastCycle(lastCycle)
                .build();
    }

    public CheckCycleSummary triggerNow() {
        return monitoringService.runManualCheck();
    }

    void tick() {
        lastTickAt = OffsetDateTime.now(clock);
        try {
            Optional<CheckCycleSummary> summary = monitoringService.tryRunCycle();
            if (summary.isEmpty()) {
                skippedTicks.incrementAndGet();
                log.warn("Previous monitoring cycle still running, skipping this tick");
            }
        } catch (Exception e) {
            // keep the timer alive; the next tick starts a fresh cycle
            log.error("Monitoring cycle failed: {}", e.getMessage(), e);
        }
    }
}
