package com.socialwatch.platform.monitoring.dto;

import com.socialwatch.platform.monitoring.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillResult {
    private UUID accountId;
    private Platform platform;
    private String targetUsername;
    private int daysBack;
    private int totalPosts;
    private int newPosts;
}
