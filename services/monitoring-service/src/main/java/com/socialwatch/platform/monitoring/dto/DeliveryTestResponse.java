package com.socialwatch.platform.monitoring.dto;

import com.socialwatch.platform.monitoring.notify.DeliveryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryTestResponse {
    private boolean success;
    private String message;
    private int statusCode;

    public static DeliveryTestResponse from(DeliveryResult result) {
        return DeliveryTestResponse.builder()
                .success(result.isSuccess())
                .message(result.isSuccess() ? "Webhook test successful" : "Webhook test failed: " + result.getErrorMessage())
                .statusCode(result.getStatusCode())
                .build();
    }
}
