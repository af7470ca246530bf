package com.socialwatch.platform.monitoring.fetcher;

import lombok.Getter;

import java.util.Map;
import java.util.stream.Collectors;

@Getter
public class AllStrategiesFailedException extends RuntimeException {

    // strategy name -> failure message, in the order they were tried
    private final Map<String, String> failures;

    public AllStrategiesFailedException(String operation, Map<String, String> failures, Throwable lastCause) {
        super(buildMessage(operation, failures), lastCause);
        this.failures = Map.copyOf(failures);
    }

    private static String buildMessage(String operation, Map<String, String> failures) {
        if (failures.isEmpty()) {
            return "No strategies available for " + operation;
        }
        return "All strategies failed for " + operation + ": " + failures.entrySet().stream()
                .map(e -> e.getKey() + " -> " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
