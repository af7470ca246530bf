package com.socialwatch.platform.monitoring.fetcher;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs strategies strictly in order and returns the first result. A failing strategy is logged
 * and the next one tried; the caller only sees an error once every strategy has failed.
 */
@Slf4j
public class StrategyChain<T> {

    private final String operation;
    private final List<FetchStrategy<T>> strategies;
    private final Duration pause;

    public StrategyChain(String operation, List<FetchStrategy<T>> strategies, Duration pause) {
        this.operation = operation;
        this.strategies = List.copyOf(strategies);
        this.pause = pause != null ? pause : Duration.ZERO;
    }

    public T execute(FetchRequest request) {
        Map<String, String> failures = new LinkedHashMap<>();
        RuntimeException lastFailure = null;
        int attempt = 0;

        for (FetchStrategy<T> strategy : strategies) {
            if (attempt > 0) {
                pauseBeforeAttempt(attempt, failures, lastFailure);
            }
            attempt++;

            try {
                T result = strategy.fetch(request);
                if (result == null) {
                    throw new PermanentUpstreamException("Strategy returned no result");
                }
                if (attempt > 1) {
                    log.info("{} for {} succeeded with strategy '{}' after {} failure(s)",
                            operation, request.getAccountId(), strategy.name(), failures.size());
                }
                return result;
            } catch (RuntimeException e) {
                lastFailure = e;
                failures.put(strategy.name(), describe(e));
                log.warn("{} for {}: strategy '{}' failed: {}",
                        operation, request.getAccountId(), strategy.name(), describe(e));
            }
        }

        throw new AllStrategiesFailedException(operation + " " + request.getAccountId(), failures, lastFailure);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(FetchStrategy::name).toList();
    }

    private void pauseBeforeAttempt(int attempt, Map<String, String> failures, RuntimeException lastFailure) {
        if (pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.multipliedBy(attempt).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AllStrategiesFailedException(operation + " (interrupted)", failures, lastFailure);
        }
    }

    private static String describe(RuntimeException e) {
        if (e instanceof UpstreamException) {
            UpstreamException upstream = (UpstreamException) e;
            String kind = upstream.isTransient() ? "transient" : "permanent";
            return upstream.getStatus() > 0
                    ? kind + " HTTP " + upstream.getStatus() + ": " + e.getMessage()
                    : kind + ": " + e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
