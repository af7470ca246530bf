package com.socialwatch.platform.monitoring.fetcher;

import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import com.socialwatch.platform.monitoring.model.Platform;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Platform-specific access to profiles and posts.
 */
public interface ContentFetcher {

    Platform getPlatform();

    PlatformProfile fetchProfile(String accountId);

    /**
     * Posts newer than {@code sinceId} or published at or after {@code sinceDate}, newest first.
     * Both bounds are optional.
     *
     * @throws AllStrategiesFailedException when the first page could not be fetched at all
     */
    List<PlatformPost> fetchRecentPosts(String accountId, String sinceId, OffsetDateTime sinceDate);

    void clearCache(String accountId);
}
