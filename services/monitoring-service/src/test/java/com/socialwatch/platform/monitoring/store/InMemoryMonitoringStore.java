package com.socialwatch.platform.monitoring.store;

import com.socialwatch.platform.monitoring.entity.DailyStat;
import com.socialwatch.platform.monitoring.entity.DiscoveredPost;
import com.socialwatch.platform.monitoring.entity.MonitoredAccount;
import com.socialwatch.platform.monitoring.entity.WebhookDestination;
import com.socialwatch.platform.monitoring.model.AccountStatus;
import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.StatField;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Map-backed store for orchestration tests.
 */
public class InMemoryMonitoringStore implements MonitoringStore {

    public final Map<UUID, MonitoredAccount> accounts = new ConcurrentHashMap<>();
    public final Map<UUID, DiscoveredPost> posts = new ConcurrentHashMap<>();
    public final Map<UUID, WebhookDestination> webhooks = new ConcurrentHashMap<>();
    public final Map<String, DailyStat> stats = new ConcurrentHashMap<>();

    public MonitoredAccount addAccount(MonitoredAccount account) {
        if (account.getId() == null) {
            account.setId(UUID.randomUUID());
        }
        accounts.put(account.getId(), account);
        return account;
    }

    public WebhookDestination addWebhook(WebhookDestination destination) {
        if (destination.getId() == null) {
            destination.setId(UUID.randomUUID());
        }
        webhooks.put(destination.getId(), destination);
        return destination;
    }

    public Optional<DiscoveredPost> findPost(Platform platform, String platformPostId) {
        return posts.values().stream()
                .filter(p -> p.getPlatform() == platform && p.getPlatformPostId().equals(platformPostId))
                .findFirst();
    }

    public int stat(UUID userId, Platform platform, LocalDate date, StatField field) {
        DailyStat stat = stats.get(statKey(userId, platform, date));
        if (stat == null) {
            return 0;
        }
        return switch (field) {
            case CHECKS_PERFORMED -> stat.getChecksPerformed();
            case POSTS_FOUND -> stat.getPostsFound();
            case NOTIFICATIONS_SENT -> stat.getNotificationsSent();
            case ERRORS -> stat.getErrors();
        };
    }

    @Override
    public List<MonitoredAccount> listDueAccounts(OffsetDateTime now) {
        return accounts.values().stream()
                .filter(a -> a.getStatus() == AccountStatus.ACTIVE && a.isDue(now))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<MonitoredAccount> findAccount(UUID accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    @Override
    public synchronized UpsertResult upsertPostIfNew(Platform platform, String platformPostId, DiscoveredPost fields) {
        Optional<DiscoveredPost> existing = findPost(platform, platformPostId);
        if (existing.isPresent()) {
            return UpsertResult.existing(existing.get().getId());
        }
        fields.setId(UUID.randomUUID());
        fields.setPlatform(platform);
        fields.setPlatformPostId(platformPostId);
        fields.setNotified(false);
        posts.put(fields.getId(), fields);
        return UpsertResult.inserted(fields.getId());
    }

    @Override
    public void updateAccountAfterCheck(UUID accountId, OffsetDateTime checkedAt, String lastPostId, String lastPostContent) {
        MonitoredAccount account = accounts.get(accountId);
        account.setLastCheckAt(checkedAt);
        if (lastPostId != null) {
            account.setLastPostId(lastPostId);
            account.setLastPostContent(lastPostContent);
        }
        account.setConsecutiveErrorCount(0);
        account.setLastErrorMessage(null);
    }

    @Override
    public int recordAccountError(UUID accountId, String message) {
        MonitoredAccount account = accounts.get(accountId);
        account.setConsecutiveErrorCount(account.getConsecutiveErrorCount() + 1);
        account.setLastErrorMessage(message);
        return account.getConsecutiveErrorCount();
    }

    @Override
    public void pauseAccount(UUID accountId) {
        accounts.get(accountId).setStatus(AccountStatus.PAUSED);
    }

    @Override
    public List<WebhookDestination> listActiveWebhooks(UUID userId) {
        return webhooks.values().stream()
                .filter(w -> Objects.equals(w.getUserId(), userId) && Boolean.TRUE.equals(w.getActive()))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<WebhookDestination> findWebhook(UUID destinationId) {
        return Optional.ofNullable(webhooks.get(destinationId));
    }

    @Override
    public void recordWebhookOutcome(UUID destinationId, boolean success, String errorMessage) {
        WebhookDestination destination = webhooks.get(destinationId);
        if (success) {
            destination.setSuccessCount(destination.getSuccessCount() + 1);
        } else {
            destination.setFailureCount(destination.getFailureCount() + 1);
            destination.setLastErrorMessage(errorMessage);
        }
    }

    @Override
    public void markPostNotified(UUID postId) {
        DiscoveredPost post = posts.get(postId);
        post.setNotified(true);
        post.setNotificationError(null);
    }

    @Override
    public void recordPostNotificationError(UUID postId, String errorMessage) {
        posts.get(postId).setNotificationError(errorMessage);
    }

    @Override
    public void incrementDailyStat(UUID userId, Platform platform, LocalDate date, StatField field) {
        stats.computeIfAbsent(statKey(userId, platform, date), k -> DailyStat.builder()
                .userId(userId)
                .platform(platform)
                .statDate(date)
                .build())
                .increment(field);
    }

    private static String statKey(UUID userId, Platform platform, LocalDate date) {
        return userId + "|" + platform + "|" + date;
    }
}
