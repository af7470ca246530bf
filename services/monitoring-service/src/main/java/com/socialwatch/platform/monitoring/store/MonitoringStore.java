package com.socialwatch.platform.monitoring.store;

import com.socialwatch.platform.monitoring.entity.DiscoveredPost;
import com.socialwatch.platform.monitoring.entity.MonitoredAccount;
import com.socialwatch.platform.monitoring.entity.WebhookDestination;
import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.StatField;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence operations the monitoring pipeline depends on.
 * Account state is only written from inside a single-flight check cycle, so implementations
 * need no locking of their own beyond what the store provides for single statements.
 */
public interface MonitoringStore {

    /**
     * Active accounts whose check interval has elapsed at {@code now}, or that were never checked.
     */
    List<MonitoredAccount> listDueAccounts(OffsetDateTime now);

    Optional<MonitoredAccount> findAccount(UUID accountId);

    /**
     * Inserts the post unless (platform, platformPostId) already exists. An existing row is left untouched.
     */
    UpsertResult upsertPostIfNew(Platform platform, String platformPostId, DiscoveredPost fields);

    void updateAccountAfterCheck(UUID accountId, OffsetDateTime checkedAt, String lastPostId, String lastPostContent);

    int recordAccountError(UUID accountId, String message);

    void pauseAccount(UUID accountId);

    List<WebhookDestination> listActiveWebhooks(UUID userId);

    Optional<WebhookDestination> findWebhook(UUID destinationId);

    void recordWebhookOutcome(UUID destinationId, boolean success, String errorMessage);

    void markPostNotified(UUID postId);

    void recordPostNotificationError(UUID postId, String errorMessage);

    void incrementDailyStat(UUID userId, Platform platform, LocalDate date, StatField field);
}
