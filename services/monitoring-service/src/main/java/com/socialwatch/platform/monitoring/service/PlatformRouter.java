package com.socialwatch.platform.monitoring.service;

import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import com.socialwatch.platform.monitoring.fetcher.AllStrategiesFailedException;
import com.socialwatch.platform.monitoring.fetcher.ContentFetcher;
import com.socialwatch.platform.monitoring.model.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
public class PlatformRouter {

    private final Map<Platform, ContentFetcher> fetchers = new EnumMap<>(Platform.class);

    public PlatformRouter(List<ContentFetcher> fetchers) {
        for (ContentFetcher fetcher : fetchers) {
            ContentFetcher previous = this.fetchers.put(fetcher.getPlatform(), fetcher);
            if (previous != null) {
                throw new IllegalStateException("Two content fetchers registered for " + fetcher.getPlatform());
            }
        }
        log.info("Content fetchers registered for {}", this.fetchers.keySet());
    }

    public ContentFetcher fetcherFor(Platform platform) {
        ContentFetcher fetcher = fetchers.get(platform);
        if (fetcher == null) {
            throw new IllegalArgumentException("Unsupported platform: " + platform);
        }
        return fetcher;
    }

    public Set<Platform> supportedPlatforms() {
        return Collections.unmodifiableSet(fetchers.keySet());
    }

    public PlatformProfile resolveProfile(Platform platform, String accountId) {
        ContentFetcher fetcher = fetcherFor(platform);
        try {
            return fetcher.fetchProfile(accountId);
        } catch (AllStrategiesFailedException e) {
            log.warn("Using placeholder profile for {} {}: {}", platform.getCode(), accountId, e.getMessage());
            return PlatformProfile.placeholder(platform, accountId);
        }
    }

    public void clearCache(Platform platform, String accountId) {
        if (platform == null) {
            fetchers.values().forEach(fetcher -> fetcher.clearCache(accountId));
        } else {
            fetcherFor(platform).clearCache(accountId);
        }
    }
}
