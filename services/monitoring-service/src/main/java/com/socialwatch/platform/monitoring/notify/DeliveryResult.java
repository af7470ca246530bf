package com.socialwatch.platform.monitoring.notify;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryResult {
    private UUID destinationId;
    private boolean success;
    // 0 when no response was received
    private int statusCode;
    private String errorMessage;
    private long durationMillis;

    public static DeliveryResult success(UUID destinationId, int statusCode, long durationMillis) {
        return DeliveryResult.builder()
                .destinationId(destinationId)
                .success(true)
                .statusCode(statusCode)
                .durationMillis(durationMillis)
                .build();
    }

    public static DeliveryResult failure(UUID destinationId, int statusCode, String errorMessage, long durationMillis) {
        return DeliveryResult.builder()
                .destinationId(destinationId)
                .success(false)
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .durationMillis(durationMillis)
                .build();
    }
}
