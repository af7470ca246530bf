package com.socialwatch.platform.monitoring.fetcher;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder(toBuilder = true)
public class FetchRequest {
    private final String accountId;
    // 1-based
    @Builder.Default
    private final int page = 1;
    // opaque continuation token from the previous page, if the platform uses one
    private final String cursor;
    private final String sinceId;
    private final OffsetDateTime sinceDate;

    public static FetchRequest of(String accountId) {
        return FetchRequest.builder().accountId(accountId).build();
    }
}
