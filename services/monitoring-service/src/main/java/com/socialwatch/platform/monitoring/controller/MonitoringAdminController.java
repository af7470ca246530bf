package com.socialwatch.platform.monitoring.controller;

import com.socialwatch.platform.monitoring.dto.BackfillResult;
import com.socialwatch.platform.monitoring.dto.CheckCycleSummary;
import com.socialwatch.platform.monitoring.dto.DeliveryTestResponse;
import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import com.socialwatch.platform.monitoring.dto.SchedulerStatusResponse;
import com.socialwatch.platform.monitoring.fetcher.AllStrategiesFailedException;
import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.notify.NotificationDispatcher;
import com.socialwatch.platform.monitoring.service.CheckInProgressException;
import com.socialwatch.platform.monitoring.service.MonitoringScheduler;
import com.socialwatch.platform.monitoring.service.MonitoringService;
import com.socialwatch.platform.monitoring.service.PlatformRouter;
import com.socialwatch.platform.monitoring.service.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/monitoring")
@RequiredArgsConstructor
@Slf4j
public class MonitoringAdminController {

    private final MonitoringScheduler scheduler;
    private final MonitoringService monitoringService;
    private final PlatformRouter platformRouter;
    private final NotificationDispatcher notificationDispatcher;

    @PostMapping("/check-now")
    public ResponseEntity<CheckCycleSummary> checkNow() {
        return ResponseEntity.ok(scheduler.triggerNow());
    }

    @GetMapping("/scheduler/status")
    public ResponseEntity<SchedulerStatusResponse> schedulerStatus() {
        return ResponseEntity.ok(scheduler.status());
    }

    @PostMapping("/scheduler/start")
    public ResponseEntity<SchedulerStatusResponse> startScheduler() {
        scheduler.start();
        return ResponseEntity.ok(scheduler.status());
    }

    @PostMapping("/scheduler/stop")
    public ResponseEntity<SchedulerStatusResponse> stopScheduler() {
        scheduler.stop();
        return ResponseEntity.ok(scheduler.status());
    }

    @PostMapping("/accounts/{accountId}/backfill")
    public ResponseEntity<BackfillResult> backfill(
            @PathVariable UUID accountId,
            @RequestParam(defaultValue = "7") int daysBack
    ) {
        return ResponseEntity.ok(monitoringService.backfill(accountId, daysBack));
    }

    @GetMapping("/profiles/{platform}/{accountId}")
    public ResponseEntity<PlatformProfile> profile(
            @PathVariable String platform,
            @PathVariable String accountId
    ) {
        return ResponseEntity.ok(platformRouter.resolveProfile(Platform.fromCode(platform), accountId));
    }

    @DeleteMapping("/profiles/cache")
    public ResponseEntity<Void> clearProfileCache(
            @RequestParam(required = false) String platform,
            @RequestParam(required = false) String accountId
    ) {
        platformRouter.clearCache(platform != null ? Platform.fromCode(platform) : null, accountId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/webhooks/{destinationId}/test")
    public ResponseEntity<DeliveryTestResponse> testWebhook(@PathVariable UUID destinationId) {
        return ResponseEntity.ok(DeliveryTestResponse.from(notificationDispatcher.sendTest(destinationId)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Monitoring Service is healthy");
    }

    @ExceptionHandler(CheckInProgressException.class)
    public ResponseEntity<Map<String, String>> handleBusy(CheckInProgressException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(AllStrategiesFailedException.class)
    public ResponseEntity<Map<String, String>> handleUpstream(AllStrategiesFailedException e) {
        log.warn("Upstream unavailable: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
