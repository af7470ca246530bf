package com.socialwatch.platform.monitoring.store;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

@Data
@AllArgsConstructor
public class UpsertResult {
    private boolean inserted;
    private UUID id;

    public static UpsertResult inserted(UUID id) {
        return new UpsertResult(true, id);
    }

    public static UpsertResult existing(UUID id) {
        return new UpsertResult(false, id);
    }
}
