package com.socialwatch.platform.monitoring.fetcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cookie jar for one platform client. Cookies come from {@code Set-Cookie} headers of any
 * response; a warm-up request is due when the session was never refreshed or has gone stale.
 */
public class PlatformSession {

    private final Clock clock;
    private final Duration refreshInterval;
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private Instant refreshedAt;

    public PlatformSession(Clock clock, Duration refreshInterval) {
        this.clock = clock;
        this.refreshInterval = refreshInterval;
    }

    public synchronized boolean needsRefresh() {
        return refreshedAt == null || !clock.instant().isBefore(refreshedAt.plus(refreshInterval));
    }

    public synchronized void markRefreshed() {
        refreshedAt = clock.instant();
    }

    public synchronized void absorb(List<String> setCookieHeaders) {
        if (setCookieHeaders == null) {
            return;
        }
        for (String header : setCookieHeaders) {
            String pair = header.split(";", 2)[0].trim();
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = pair.substring(0, eq).trim();
            String value = pair.substring(eq + 1).trim();
            if (value.isEmpty() || "deleted".equals(value)) {
                cookies.remove(name);
            } else {
                cookies.put(name, value);
            }
        }
    }

    public synchronized Optional<String> cookieHeader() {
        if (cookies.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; ")));
    }

    public synchronized void reset() {
        cookies.clear();
        refreshedAt = null;
    }
}
