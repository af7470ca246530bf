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
public class CheckCycleSummary {
    // "scheduled" or "manual"
    private String trigger;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private int accountsChecked;
    private int accountsFailed;
    private int accountsPaused;
    private int newPosts;
    private int notificationsSent;
}
