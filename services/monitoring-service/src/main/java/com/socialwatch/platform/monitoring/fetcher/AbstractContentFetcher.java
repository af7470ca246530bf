package com.socialwatch.platform.monitoring.fetcher;

import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.dto.PlatformProfile;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared fetcher plumbing: profile cache, strategy chains and bounded pagination. Subclasses
 * only contribute their strategies.
 */
@Slf4j
public abstract class AbstractContentFetcher implements ContentFetcher {

    private static final Comparator<PlatformPost> NEWEST_FIRST = Comparator
            .comparing(PlatformPost::getPublishedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(PlatformPost::getPostId, AbstractContentFetcher::compareIdsDescending);

    protected final MonitoringProperties.Fetch settings;
    protected final Clock clock;
    private final ProfileCache profileCache;

    protected AbstractContentFetcher(MonitoringProperties.Fetch settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.profileCache = new ProfileCache(clock, settings.getProfileCacheTtl());
    }

    protected abstract List<FetchStrategy<PlatformProfile>> profileStrategies();

    protected abstract List<FetchStrategy<PostPage>> postStrategies();

    @Override
    public PlatformProfile fetchProfile(String accountId) {
        Optional<PlatformProfile> cached = profileCache.get(accountId);
        if (cached.isPresent()) {
            log.debug("Profile cache hit for {} {}", getPlatform().getCode(), accountId);
            return cached.get();
        }

        PlatformProfile profile = new StrategyChain<>(getPlatform().getCode() + " profile",
                profileStrategies(), settings.getStrategyPause())
                .execute(FetchRequest.of(accountId));
        profileCache.put(accountId, profile);
        return profile;
    }

    @Override
    public List<PlatformPost> fetchRecentPosts(String accountId, String sinceId, OffsetDateTime sinceDate) {
        StrategyChain<PostPage> chain = new StrategyChain<>(getPlatform().getCode() + " posts",
                postStrategies(), settings.getStrategyPause());
        int pageCap = sinceDate != null ? settings.getMaxPages() : settings.getRecentPages();

        Map<String, PlatformPost> collected = new LinkedHashMap<>();
        String cursor = null;
        for (int page = 1; page <= pageCap; page++) {
            FetchRequest request = FetchRequest.builder()
                    .accountId(accountId)
                    .page(page)
                    .cursor(cursor)
                    .sinceId(sinceId)
                    .sinceDate(sinceDate)
                    .build();

            PostPage result;
            try {
                result = chain.execute(request);
            } catch (AllStrategiesFailedException e) {
                if (page == 1) {
                    throw e;
                }
                log.warn("Stopping pagination for {} {} at page {}: {}",
                        getPlatform().getCode(), accountId, page, e.getMessage());
                break;
            }

            boolean reachedBoundary = false;
            for (PlatformPost post : result.getPosts()) {
                if (post.getPostId() == null) {
                    continue;
                }
                if (sinceDate != null) {
                    // an undated post cannot be placed inside the requested range
                    if (post.getPublishedAt() == null) {
                        continue;
                    }
                    if (post.getPublishedAt().isBefore(sinceDate)) {
                        reachedBoundary = true;
                        continue;
                    }
                }
                if (sinceId != null && !isNewer(post.getPostId(), sinceId)) {
                    reachedBoundary = true;
                    continue;
                }
                collected.putIfAbsent(post.getPostId(), post);
            }

            if (reachedBoundary || !result.isHasMore() || result.getPosts().isEmpty()) {
                break;
            }
            cursor = result.getNextCursor();
        }

        List<PlatformPost> posts = new ArrayList<>(collected.values());
        posts.sort(NEWEST_FIRST);
        log.debug("Fetched {} post(s) for {} {}", posts.size(), getPlatform().getCode(), accountId);
        return posts;
    }

    @Override
    public void clearCache(String accountId) {
        profileCache.clear(accountId);
    }

    static boolean isNewer(String postId, String sinceId) {
        if (isNumeric(postId) && isNumeric(sinceId)) {
            return new BigInteger(postId).compareTo(new BigInteger(sinceId)) > 0;
        }
        return !postId.equals(sinceId);
    }

    private static int compareIdsDescending(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            return new BigInteger(b).compareTo(new BigInteger(a));
        }
        return b.compareTo(a);
    }

    private static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
