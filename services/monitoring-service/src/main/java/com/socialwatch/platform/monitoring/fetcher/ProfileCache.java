package com.socialwatch.platform.monitoring.fetcher;

import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class ProfileCache {

    private final Clock clock;
    private final Duration ttl;
    private final Map<String, CachedProfile> entries = new ConcurrentHashMap<>();

    public ProfileCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public Optional<PlatformProfile> get(String accountId) {
        CachedProfile cached = entries.get(accountId);
        if (cached == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(cached.getFetchedAt().plus(ttl))) {
            entries.remove(accountId, cached);
            return Optional.empty();
        }
        return Optional.of(cached.getProfile());
    }

    public void put(String accountId, PlatformProfile profile) {
        // placeholders must not hide a recovered upstream
        if (profile == null || profile.isPlaceholder()) {
            return;
        }
        entries.put(accountId, new CachedProfile(profile, clock.instant()));
    }

    public void clear(String accountId) {
        if (accountId == null) {
            entries.clear();
        } else {
            entries.remove(accountId);
        }
    }

    public int size() {
        return entries.size();
    }

    @Value
    static class CachedProfile {
        PlatformProfile profile;
        Instant fetchedAt;
    }
}
