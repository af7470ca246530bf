package com.socialwatch.platform.monitoring.service;

import com.socialwatch.platform.monitoring.config.MonitoringProperties;
import com.socialwatch.platform.monitoring.dto.BackfillResult;
import com.socialwatch.platform.monitoring.dto.CheckCycleSummary;
import com.socialwatch.platform.monitoring.dto.PlatformPost;
import com.socialwatch.platform.monitoring.entity.DiscoveredPost;
import com.socialwatch.platform.monitoring.entity.MonitoredAccount;
import com.socialwatch.platform.monitoring.fetcher.AllStrategiesFailedException;
import com.socialwatch.platform.monitoring.fetcher.UpstreamException;
import com.socialwatch.platform.monitoring.model.StatField;
import com.socialwatch.platform.monitoring.notify.NotificationDispatcher;
import com.socialwatch.platform.monitoring.notify.PostNotification;
import com.socialwatch.platform.monitoring.store.MonitoringStore;
import com.socialwatch.platform.monitoring.store.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs check cycles: picks the due accounts, pulls their new posts, stores them once and
 * forwards them to the owners' webhooks. At most one cycle or backfill runs at a time.
 */
@Service
@Slf4j
public class MonitoringService {

    private final MonitoringStore store;
    private final PlatformRouter router;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final ZoneId zone;
    private final int pauseThreshold;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile CheckCycleSummary lastCycle;

    public MonitoringService(MonitoringStore store, PlatformRouter router, NotificationDispatcher dispatcher,
                             MonitoringProperties properties, Clock clock) {
        this.store = store;
        this.router = router;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.zone = properties.getScheduler().getZoneId();
        this.pauseThreshold = properties.getCheck().getPauseThreshold();
    }

    public Optional<CheckCycleSummary> tryRunCycle() {
        return runExclusively(() -> runCycle("scheduled"));
    }

    public CheckCycleSummary runManualCheck() {
        return runExclusively(() -> runCycle("manual")).orElseThrow(CheckInProgressException::new);
    }

    /**
     * Stores the posts an account published over the last {@code daysBack} days without
     * notifying anyone.
     *
     * @throws CheckInProgressException when a cycle is running
     */
    public BackfillResult backfill(UUID accountId, int daysBack) {
        if (daysBack < 1) {
            throw new IllegalArgumentException("daysBack must be at least 1");
        }
        MonitoredAccount account = store.findAccount(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Monitored account not found: " + accountId));
        return runExclusively(() -> runBackfill(account, daysBack)).orElseThrow(CheckInProgressException::new);
    }

    public boolean isCycleRunning() {
        return cycleLock.isLocked();
    }

    public CheckCycleSummary getLastCycle() {
        return lastCycle;
    }

    private <T> Optional<T> runExclusively(Supplier<T> work) {
        if (!cycleLock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.of(work.get());
        } finally {
            cycleLock.unlock();
        }
    }

    private CheckCycleSummary runCycle(String trigger) {
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        List<MonitoredAccount> dueAccounts = store.listDueAccounts(startedAt);
        log.info("Starting {} monitoring cycle, {} account(s) due", trigger, dueAccounts.size());

        CheckCycleSummary summary = CheckCycleSummary.builder()
                .trigger(trigger)
                .startedAt(startedAt)
                .build();

        for (MonitoredAccount account : dueAccounts) {
            summary.setAccountsChecked(summary.getAccountsChecked() + 1);
            try {
                AccountCheck check = checkAccount(account);
                summary.setNewPosts(summary.getNewPosts() + check.newPosts);
                summary.setNotificationsSent(summary.getNotificationsSent() + check.notificationsSent);
            } catch (Exception e) {
                summary.setAccountsFailed(summary.getAccountsFailed() + 1);
                if (recordFailure(account, e)) {
                    summary.setAccountsPaused(summary.getAccountsPaused() + 1);
                }
            }
        }

        summary.setFinishedAt(OffsetDateTime.now(clock));
        lastCycle = summary;
        log.info("Monitoring cycle finished: {} checked, {} failed, {} paused, {} new post(s), {} notification(s)",
                summary.getAccountsChecked(), summary.getAccountsFailed(), summary.getAccountsPaused(),
                summary.getNewPosts(), summary.getNotificationsSent());
        return summary;
    }

    private AccountCheck checkAccount(MonitoredAccount account) {
        log.debug("Checking {} on {}", account.label(), account.getPlatform().getCode());
        incrementStat(account, StatField.CHECKS_PERFORMED);

        List<PlatformPost> posts = router.fetcherFor(account.getPlatform())
                .fetchRecentPosts(account.getTargetAccountId(), account.getLastPostId(), null);

        // persist everything before anything is sent
        Map<UUID, PlatformPost> inserted = persistNewPosts(account, posts);

        int sent = 0;
        for (Map.Entry<UUID, PlatformPost> entry : inserted.entrySet()) {
            try {
                sent += dispatcher.dispatch(account, entry.getKey(), PostNotification.of(account, entry.getValue()));
            } catch (RuntimeException e) {
                log.error("Notification fan-out failed for post {} of {}: {}",
                        entry.getValue().getPostId(), account.label(), e.getMessage(), e);
            }
        }

        PlatformPost newest = posts.isEmpty() ? null : posts.get(0);
        store.updateAccountAfterCheck(account.getId(), OffsetDateTime.now(clock),
                newest != null ? newest.getPostId() : null,
                newest != null ? newest.getContent() : null);

        if (!inserted.isEmpty()) {
            log.info("Found {} new post(s) for {} on {}", inserted.size(), account.label(), account.getPlatform().getCode());
        }
        return new AccountCheck(inserted.size(), sent);
    }

    private Map<UUID, PlatformPost> persistNewPosts(MonitoredAccount account, List<PlatformPost> posts) {
        Map<UUID, PlatformPost> inserted = new LinkedHashMap<>();
        for (int i = posts.size() - 1; i >= 0; i--) {
            PlatformPost post = posts.get(i);
            UpsertResult result = store.upsertPostIfNew(account.getPlatform(), post.getPostId(), toEntity(account, post));
            if (result.isInserted()) {
                inserted.put(result.getId(), post);
                incrementStat(account, StatField.POSTS_FOUND);
            } else {
                log.debug("Post {} already stored, skipping", post.getPostId());
            }
        }
        return inserted;
    }

    private BackfillResult runBackfill(MonitoredAccount account, int daysBack) {
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(daysBack);
        log.info("Backfilling {} on {} since {}", account.label(), account.getPlatform().getCode(), since);

        List<PlatformPost> posts = router.fetcherFor(account.getPlatform())
                .fetchRecentPosts(account.getTargetAccountId(), null, since);
        int stored = persistNewPosts(account, posts).size();

        PlatformPost newest = posts.isEmpty() ? null : posts.get(0);
        boolean advancesLastPost = newest != null && account.getLastPostId() == null;
        store.updateAccountAfterCheck(account.getId(), OffsetDateTime.now(clock),
                advancesLastPost ? newest.getPostId() : null,
                advancesLastPost ? newest.getContent() : null);

        log.info("Backfill of {} stored {} new post(s) out of {}", account.label(), stored, posts.size());
        return BackfillResult.builder()
                .accountId(account.getId())
                .platform(account.getPlatform())
                .targetUsername(account.getTargetUsername())
                .daysBack(daysBack)
                .totalPosts(posts.size())
                .newPosts(stored)
                .build();
    }

    private boolean recordFailure(MonitoredAccount account, Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof AllStrategiesFailedException || error instanceof UpstreamException) {
            log.warn("Check failed for {} on {}: {}", account.label(), account.getPlatform(), message);
        } else {
            log.error("Check failed for {} on {}", account.label(), account.getPlatform(), error);
        }

        try {
            incrementStat(account, StatField.ERRORS);
            int errors = store.recordAccountError(account.getId(), message);
            if (errors >= pauseThreshold) {
                store.pauseAccount(account.getId());
                log.warn("Monitoring paused for {} after {} consecutive errors", account.label(), errors);
                return true;
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure for account {}: {}", account.getId(), e.getMessage(), e);
        }
        return false;
    }

    private DiscoveredPost toEntity(MonitoredAccount account, PlatformPost post) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (post.getMetadata() != null) {
            metadata.putAll(post.getMetadata());
        }
        putIfPresent(metadata, "likes", post.getLikes());
        putIfPresent(metadata, "shares", post.getShares());
        putIfPresent(metadata, "comments", post.getComments());
        putIfPresent(metadata, "views", post.getViews());

        return DiscoveredPost.builder()
                .accountId(account.getId())
                .platform(account.getPlatform())
                .platformPostId(post.getPostId())
                .postUrl(post.getPostUrl())
                .postType(post.getPostType())
                .content(post.getContent())
                .imageUrls(new ArrayList<>(post.getImageUrls() != null ? post.getImageUrls() : List.of()))
                .videoUrls(new ArrayList<>(post.getVideoUrls() != null ? post.getVideoUrls() : List.of()))
                .rawMetadata(metadata)
                .publishedAt(post.getPublishedAt())
                .build();
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private void incrementStat(MonitoredAccount account, StatField field) {
        try {
            store.incrementDailyStat(account.getUserId(), account.getPlatform(), LocalDate.now(clock.withZone(zone)), field);
        } catch (RuntimeException e) {
            log.error("Could not update {} statistic for user {}: {}", field, account.getUserId(), e.getMessage());
        }
    }

    private static final class AccountCheck {
        private final int newPosts;
        private final int notificationsSent;

        private AccountCheck(int newPosts, int notificationsSent) {
            this.newPosts = newPosts;
            this.notificationsSent = notificationsSent;
        }
    }
}
