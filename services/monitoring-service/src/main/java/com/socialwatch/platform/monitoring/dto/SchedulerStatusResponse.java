package com.socialwatch.platform.monitoring.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {
    private boolean running;
    private boolean cycleInProgress;
    private long intervalSeconds;
    private OffsetDateTime startedAt;
    private OffsetDateTime lastTickAt;
    private int skippedTicks;
    private CheckCycleSummary lastCycle;
}
